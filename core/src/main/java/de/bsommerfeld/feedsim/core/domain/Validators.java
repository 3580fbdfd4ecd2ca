package de.bsommerfeld.feedsim.core.domain;

/**
 * Field-level checks shared by the domain records. Every check throws
 * {@link IllegalArgumentException} naming the offending field so that callers
 * (and row mappers in the database module) can report precisely what was
 * wrong.
 */
public final class Validators {

    private Validators() {
    }

    /**
     * Rejects {@code null}, empty and whitespace-only strings.
     *
     * @return the value, unchanged
     */
    public static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be empty");
        }
        return value;
    }

    public static int requirePositive(int value, String field) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be greater than 0, was " + value);
        }
        return value;
    }

    public static int requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must be >= 0, was " + value);
        }
        return value;
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
        return value;
    }
}
