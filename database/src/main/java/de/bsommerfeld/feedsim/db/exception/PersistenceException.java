package de.bsommerfeld.feedsim.db.exception;

/**
 * Root of every exception raised by the persistence layer. Unchecked so that
 * repository signatures stay clean; callers catch the concrete subtypes they
 * can act on.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
