package de.bsommerfeld.feedsim.core.domain;

import java.time.Instant;

/**
 * One end-to-end simulation execution. Created once in {@link RunStatus#RUNNING}
 * and afterwards only changed through status transitions; never deleted.
 *
 * <p>
 * Invariant: {@code completedAt} is non-null exactly when the status is
 * {@link RunStatus#COMPLETED}, and never precedes {@code startedAt}.
 *
 * @param runId       globally unique, opaque identifier
 * @param createdAt   creation time
 * @param startedAt   start time (equal to {@code createdAt} for runs created
 *                    by the repository)
 * @param totalTurns  number of turns, {@code > 0}
 * @param totalAgents number of agents, {@code > 0}
 * @param status      current lifecycle state
 * @param completedAt completion time, {@code null} unless completed
 */
public record Run(
        String runId,
        Instant createdAt,
        Instant startedAt,
        int totalTurns,
        int totalAgents,
        RunStatus status,
        Instant completedAt) {

    public Run {
        Validators.requireNonBlank(runId, "run_id");
        Validators.requirePresent(createdAt, "created_at");
        Validators.requirePresent(startedAt, "started_at");
        Validators.requirePositive(totalTurns, "total_turns");
        Validators.requirePositive(totalAgents, "total_agents");
        Validators.requirePresent(status, "status");

        if (status == RunStatus.COMPLETED && completedAt == null) {
            throw new IllegalArgumentException("completed_at must be set when status is completed");
        }
        if (status != RunStatus.COMPLETED && completedAt != null) {
            throw new IllegalArgumentException("completed_at must be null when status is " + status.value());
        }
        if (completedAt != null && completedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("completed_at cannot precede started_at");
        }
    }

    /**
     * Returns a copy in the given state. {@code completedAt} is only kept for
     * {@link RunStatus#COMPLETED}.
     */
    public Run withStatus(RunStatus newStatus, Instant newCompletedAt) {
        return new Run(runId, createdAt, startedAt, totalTurns, totalAgents, newStatus,
                newStatus == RunStatus.COMPLETED ? newCompletedAt : null);
    }
}
