package de.bsommerfeld.feedsim.db.exception;

/**
 * Turn metadata is write-once per {@code (runId, turnNumber)}; a second write
 * for the same key is a programming error, never an overwrite.
 */
public class DuplicateTurnMetadataException extends PersistenceException {

    private final String runId;
    private final int turnNumber;

    public DuplicateTurnMetadataException(String runId, int turnNumber) {
        super("Turn metadata already exists for run '" + runId + "', turn " + turnNumber);
        this.runId = runId;
        this.turnNumber = turnNumber;
    }

    public String getRunId() {
        return runId;
    }

    public int getTurnNumber() {
        return turnNumber;
    }
}
