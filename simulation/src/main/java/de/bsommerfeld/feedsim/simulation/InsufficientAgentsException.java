package de.bsommerfeld.feedsim.simulation;

public class InsufficientAgentsException extends RuntimeException {

    private final int requested;
    private final int available;

    public InsufficientAgentsException(int requested, int available) {
        super("Requested " + requested + " agents but only " + available + " profiles are available");
        this.requested = requested;
        this.available = available;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
