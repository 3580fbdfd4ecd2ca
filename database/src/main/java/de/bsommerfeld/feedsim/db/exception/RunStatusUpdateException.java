package de.bsommerfeld.feedsim.db.exception;

public class RunStatusUpdateException extends PersistenceException {

    private final String runId;
    private final String reason;

    public RunStatusUpdateException(String runId, String reason, Throwable cause) {
        super(reason == null
                ? "Failed to update run status for '" + runId + "'"
                : "Failed to update run status for '" + runId + "': " + reason, cause);
        this.runId = runId;
        this.reason = reason;
    }

    public String getRunId() {
        return runId;
    }

    public String getReason() {
        return reason;
    }
}
