package de.bsommerfeld.feedsim.db.exception;

public class RunNotFoundException extends PersistenceException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run '" + runId + "' not found");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
