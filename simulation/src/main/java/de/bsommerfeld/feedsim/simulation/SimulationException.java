package de.bsommerfeld.feedsim.simulation;

/**
 * A run did not complete. The message names the run (and the turn, if the
 * failure happened inside one); the triggering exception is the cause.
 */
public class SimulationException extends RuntimeException {

    private final String runId;
    private final Integer turnNumber;

    public SimulationException(String runId, Integer turnNumber, Throwable cause) {
        super("Run " + runId + " failed" + (turnNumber == null ? "" : " in turn " + turnNumber)
                + ": " + cause.getMessage(), cause);
        this.runId = runId;
        this.turnNumber = turnNumber;
    }

    public String getRunId() {
        return runId;
    }

    /** Failing turn, or {@code null} if the run failed outside a turn. */
    public Integer getTurnNumber() {
        return turnNumber;
    }
}
