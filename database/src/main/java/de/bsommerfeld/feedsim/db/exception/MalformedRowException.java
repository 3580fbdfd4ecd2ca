package de.bsommerfeld.feedsim.db.exception;

/**
 * A stored row could not be mapped to its domain record: a required column
 * was {@code NULL}, or a value was rejected by the record's validation.
 */
public class MalformedRowException extends PersistenceException {

    private final String field;
    private final String context;

    public MalformedRowException(String field, String context, String detail) {
        this(field, context, detail, null);
    }

    public MalformedRowException(String field, String context, String detail, Throwable cause) {
        super("Malformed row in " + context + ": field '" + field + "' " + detail, cause);
        this.field = field;
        this.context = context;
    }

    public String getField() {
        return field;
    }

    public String getContext() {
        return context;
    }
}
