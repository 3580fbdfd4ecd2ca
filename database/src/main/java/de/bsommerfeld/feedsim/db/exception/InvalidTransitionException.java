package de.bsommerfeld.feedsim.db.exception;

import de.bsommerfeld.feedsim.core.domain.RunStatus;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * A status change that the run state machine does not allow. For terminal
 * states {@link #getValidTransitions()} is empty.
 */
public class InvalidTransitionException extends PersistenceException {

    private final String runId;
    private final RunStatus currentStatus;
    private final RunStatus targetStatus;
    private final Set<RunStatus> validTransitions;

    public InvalidTransitionException(String runId, RunStatus currentStatus, RunStatus targetStatus,
            Set<RunStatus> validTransitions) {
        super("Invalid status transition for run '" + runId + "': "
                + currentStatus.value() + " -> " + targetStatus.value()
                + ". Valid transitions from " + currentStatus.value() + " are: "
                + describe(validTransitions));
        this.runId = runId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
        this.validTransitions = Set.copyOf(validTransitions);
    }

    private static String describe(Set<RunStatus> validTransitions) {
        if (validTransitions.isEmpty()) {
            return "none (terminal state)";
        }
        return validTransitions.stream()
                .sorted()
                .map(RunStatus::value)
                .collect(Collectors.joining(", "));
    }

    public String getRunId() {
        return runId;
    }

    public RunStatus getCurrentStatus() {
        return currentStatus;
    }

    public RunStatus getTargetStatus() {
        return targetStatus;
    }

    public Set<RunStatus> getValidTransitions() {
        return validTransitions;
    }
}
