package de.bsommerfeld.feedsim.db.adapter;

import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.db.exception.DuplicateTurnMetadataException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence gateway for {@link Run}s and their {@link TurnMetadata}. No
 * state-machine checks happen here; see the run repository for those.
 */
public interface RunAdapter {

    void writeRun(Run run);

    Optional<Run> readRun(String runId);

    /** All runs, newest {@code createdAt} first. */
    List<Run> readAllRuns();

    /**
     * Overwrites status and completion time, provided the run is still in
     * {@code expected}. The check and the write are a single statement.
     *
     * @return {@code false} if no run with this id is in {@code expected},
     *         either because it does not exist or because its status changed
     */
    boolean updateRunStatus(String runId, RunStatus expected, RunStatus status, Instant completedAt);

    Optional<TurnMetadata> readTurnMetadata(String runId, int turnNumber);

    /** Metadata of every recorded turn of {@code runId}, ascending. */
    List<TurnMetadata> readTurnMetadataForRun(String runId);

    /**
     * Inserts a new record.
     *
     * @throws DuplicateTurnMetadataException if the key is already taken
     */
    void writeTurnMetadata(TurnMetadata metadata);
}
