package de.bsommerfeld.feedsim.simulation;

import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.domain.Validators;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * In-memory outcome of one simulated turn.
 *
 * @param turnNumber      0-indexed turn
 * @param totalActions    count per action kind
 * @param executionTimeMs wall time spent in the turn
 */
public record TurnResult(int turnNumber, Map<TurnAction, Integer> totalActions, long executionTimeMs) {

    public TurnResult {
        Validators.requireNonNegative(turnNumber, "turn_number");
        Validators.requirePresent(totalActions, "total_actions");
        EnumMap<TurnAction, Integer> copy = new EnumMap<>(TurnAction.class);
        copy.putAll(totalActions);
        totalActions = Collections.unmodifiableMap(copy);
    }
}
