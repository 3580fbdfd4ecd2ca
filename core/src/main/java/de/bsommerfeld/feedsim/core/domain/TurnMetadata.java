package de.bsommerfeld.feedsim.core.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregated action counts for one turn of one run. The key
 * {@code (runId, turnNumber)} is write-once.
 *
 * @param runId        owning run
 * @param turnNumber   0-indexed turn, {@code >= 0}
 * @param totalActions count per action kind; copied into an unmodifiable
 *                     {@link EnumMap}
 * @param createdAt    time the record was produced
 */
public record TurnMetadata(
        String runId,
        int turnNumber,
        Map<TurnAction, Integer> totalActions,
        Instant createdAt) {

    public TurnMetadata {
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        Validators.requirePresent(totalActions, "total_actions");
        Validators.requirePresent(createdAt, "created_at");

        EnumMap<TurnAction, Integer> copy = new EnumMap<>(TurnAction.class);
        for (Map.Entry<TurnAction, Integer> entry : totalActions.entrySet()) {
            TurnAction action = Validators.requirePresent(entry.getKey(), "total_actions key");
            int count = Validators.requirePresent(entry.getValue(), "total_actions[" + action.value() + "]");
            copy.put(action, Validators.requireNonNegative(count, "total_actions[" + action.value() + "]"));
        }
        totalActions = Collections.unmodifiableMap(copy);
    }

    /** Count for a single action kind, {@code 0} if absent. */
    public int count(TurnAction action) {
        return totalActions.getOrDefault(action, 0);
    }
}
