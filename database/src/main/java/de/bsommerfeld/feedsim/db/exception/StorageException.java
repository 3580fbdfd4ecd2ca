package de.bsommerfeld.feedsim.db.exception;

/**
 * Transport-level failure of the underlying store (connectivity, locking,
 * constraint violations without a domain meaning). Carries the operation and
 * the key it was executed for.
 */
public class StorageException extends PersistenceException {

    private final String operation;
    private final String key;

    public StorageException(String operation, String key, Throwable cause) {
        super("Storage failure during " + operation + (key == null ? "" : " [" + key + "]")
                + ": " + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.operation = operation;
        this.key = key;
    }

    public String getOperation() {
        return operation;
    }

    public String getKey() {
        return key;
    }
}
