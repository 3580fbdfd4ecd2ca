package de.bsommerfeld.feedsim.core.domain;

/**
 * Closed set of actions an agent can take on a turn. The persisted form is
 * the lower-case {@link #value()}.
 */
public enum TurnAction {

    LIKE("like"),
    COMMENT("comment"),
    FOLLOW("follow");

    private final String value;

    TurnAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for {@code null} or unknown values
     */
    public static TurnAction fromValue(String value) {
        for (TurnAction action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown turn action: " + value);
    }
}
