package de.bsommerfeld.feedsim.core.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a simulation {@link Run}.
 *
 * <pre>
 *   RUNNING ──► COMPLETED   (all turns simulated)
 *      │
 *      └─────► FAILED      (error or abandonment)
 * </pre>
 *
 * Every run starts in {@link #RUNNING}. {@link #COMPLETED} and {@link #FAILED}
 * are terminal. The persisted form is the lower-case {@link #value()}.
 */
public enum RunStatus {

    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    RunStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Targets reachable from this state. {@code RUNNING -> RUNNING} is accepted
     * as an idempotent re-write; terminal states return an empty set.
     */
    public Set<RunStatus> validTransitions() {
        if (this == RUNNING) {
            return Collections.unmodifiableSet(EnumSet.of(RUNNING, COMPLETED, FAILED));
        }
        return Collections.emptySet();
    }

    public boolean canTransitionTo(RunStatus target) {
        return validTransitions().contains(target);
    }

    public boolean isTerminal() {
        return validTransitions().isEmpty();
    }

    /**
     * Parses the persisted representation.
     *
     * @throws IllegalArgumentException for {@code null} or unknown values
     */
    public static RunStatus fromValue(String value) {
        for (RunStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
