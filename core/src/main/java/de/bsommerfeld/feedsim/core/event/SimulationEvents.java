package de.bsommerfeld.feedsim.core.event;

import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.TurnAction;

import java.util.Map;

/**
 * Lifecycle events published by the simulation engine.
 */
public class SimulationEvents {

    private SimulationEvents() {
    }

    public record RunStartedEvent(String runId, int totalAgents, int totalTurns) {
    }

    public record TurnCompletedEvent(String runId, int turnNumber, Map<TurnAction, Integer> totalActions,
            long executionTimeMs) {
    }

    /**
     * Fired once per run after the final status transition was attempted.
     * {@code failureMessage} is {@code null} for completed runs.
     */
    public record RunFinishedEvent(String runId, RunStatus status, String failureMessage) {
    }

    /** Fired by the reconciler for every abandoned run it marks as failed. */
    public record StaleRunFailedEvent(String runId) {
    }
}
