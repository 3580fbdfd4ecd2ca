package de.bsommerfeld.feedsim.db.repository;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunConfig;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.adapter.RunAdapter;
import de.bsommerfeld.feedsim.db.exception.DuplicateTurnMetadataException;
import de.bsommerfeld.feedsim.db.exception.InvalidTransitionException;
import de.bsommerfeld.feedsim.db.exception.PersistenceException;
import de.bsommerfeld.feedsim.db.exception.RunCreationException;
import de.bsommerfeld.feedsim.db.exception.RunNotFoundException;
import de.bsommerfeld.feedsim.db.exception.RunStatusUpdateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the {@link Run} lifecycle and its {@link TurnMetadata}.
 *
 * <p>
 * Status changes are checked against {@link RunStatus#validTransitions()}
 * before anything is written: {@code RUNNING} may move to {@code COMPLETED} or
 * {@code FAILED} (or be re-written as {@code RUNNING}); both other states are
 * terminal. The write only applies while the run is still in the status that
 * was read, so of two concurrent writers at most one leaves {@code RUNNING}.
 * Domain errors ({@link RunNotFoundException},
 * {@link InvalidTransitionException}) always reach the caller unwrapped; other
 * storage failures are wrapped in {@link RunStatusUpdateException}.
 *
 * <p>
 * Turn metadata is write-once per {@code (runId, turnNumber)}. A duplicate is
 * detected by a read before the insert, and the insert itself maps a key
 * collision to {@link DuplicateTurnMetadataException} for concurrent writers.
 */
@Singleton
public class RunRepository {

    private static final Logger LOG = LoggerFactory.getLogger(RunRepository.class);

    private final RunAdapter adapter;
    private final Clock clock;

    @Inject
    public RunRepository(RunAdapter adapter, Clock clock) {
        this.adapter = adapter;
        this.clock = clock;
    }

    /**
     * Creates and persists a new run in {@link RunStatus#RUNNING}.
     *
     * @throws RunCreationException if the run could not be stored
     */
    public Run createRun(RunConfig config) {
        Validators.requirePresent(config, "config");
        Instant now = Timestamps.now(clock);
        String runId = newRunId(now);
        Run run = new Run(runId, now, now, config.numTurns(), config.numAgents(), RunStatus.RUNNING, null);
        try {
            adapter.writeRun(run);
        } catch (PersistenceException e) {
            throw new RunCreationException(runId, e.getMessage(), e);
        }
        LOG.info("Created run {} ({} agents, {} turns)", runId, run.totalAgents(), run.totalTurns());
        return run;
    }

    public Optional<Run> getRun(String runId) {
        Validators.requireNonBlank(runId, "run_id");
        return adapter.readRun(runId);
    }

    /** All runs, newest first. */
    public List<Run> listRuns() {
        return adapter.readAllRuns();
    }

    /**
     * Moves a run to {@code target}. {@code completedAt} is set to now for
     * {@link RunStatus#COMPLETED} and cleared otherwise.
     *
     * @return the run as stored after the update
     * @throws RunNotFoundException       if no run has this id
     * @throws InvalidTransitionException if the current state does not allow
     *                                    {@code target}
     * @throws RunStatusUpdateException   on any other storage failure
     */
    public Run updateRunStatus(String runId, RunStatus target) {
        Validators.requireNonBlank(runId, "run_id");
        Validators.requirePresent(target, "status");
        try {
            Run current = adapter.readRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
            if (!current.status().canTransitionTo(target)) {
                throw new InvalidTransitionException(runId, current.status(), target,
                        current.status().validTransitions());
            }
            Instant completedAt = target == RunStatus.COMPLETED ? Timestamps.now(clock) : null;
            if (!adapter.updateRunStatus(runId, current.status(), target, completedAt)) {
                // another writer moved the run after it was read
                Run changed = adapter.readRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
                throw new InvalidTransitionException(runId, changed.status(), target,
                        changed.status().validTransitions());
            }
            LOG.info("Run {} transitioned {} -> {}", runId, current.status().value(), target.value());
            return current.withStatus(target, completedAt);
        } catch (RunNotFoundException | InvalidTransitionException e) {
            throw e;
        } catch (PersistenceException e) {
            throw new RunStatusUpdateException(runId, e.getMessage(), e);
        }
    }

    public Optional<TurnMetadata> getTurnMetadata(String runId, int turnNumber) {
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        return adapter.readTurnMetadata(runId, turnNumber);
    }

    /** Every recorded turn of a run, ascending by turn number. */
    public List<TurnMetadata> listTurnMetadata(String runId) {
        Validators.requireNonBlank(runId, "run_id");
        return adapter.readTurnMetadataForRun(runId);
    }

    /**
     * Stores the metadata of a finished turn.
     *
     * @throws RunNotFoundException           if the parent run does not exist
     * @throws IllegalArgumentException       if the turn is outside the run's
     *                                        range
     * @throws DuplicateTurnMetadataException if the turn was already recorded
     */
    public void writeTurnMetadata(TurnMetadata metadata) {
        Validators.requirePresent(metadata, "metadata");
        String runId = metadata.runId();
        int turnNumber = metadata.turnNumber();

        Run run = adapter.readRun(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (turnNumber >= run.totalTurns()) {
            throw new IllegalArgumentException("turn_number " + turnNumber + " out of range for run " + runId
                    + " with " + run.totalTurns() + " turns");
        }
        if (adapter.readTurnMetadata(runId, turnNumber).isPresent()) {
            throw new DuplicateTurnMetadataException(runId, turnNumber);
        }
        adapter.writeTurnMetadata(metadata);
    }

    static String newRunId(Instant now) {
        return "run_" + Timestamps.compact(now) + "_" + UUID.randomUUID();
    }
}
