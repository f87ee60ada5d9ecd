package org.civicroute.engine.exception;

/**
 * Thrown when the item store rejects or fails a read or commit.
 * A failed commit leaves the item exactly as it was.
 */
public class PersistenceException extends RoutingException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
