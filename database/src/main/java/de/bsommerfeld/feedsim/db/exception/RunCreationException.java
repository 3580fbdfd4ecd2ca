package de.bsommerfeld.feedsim.db.exception;

public class RunCreationException extends PersistenceException {

    private final String runId;
    private final String reason;

    public RunCreationException(String runId, String reason, Throwable cause) {
        super(reason == null
                ? "Failed to create run '" + runId + "'"
                : "Failed to create run '" + runId + "': " + reason, cause);
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
