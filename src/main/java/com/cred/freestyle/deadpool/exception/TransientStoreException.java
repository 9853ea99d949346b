package com.cred.freestyle.deadpool.exception;

/**
 * Exception thrown when the entity store is temporarily unavailable
 * (timeouts, throttling, lost connections, contended locks).
 * Callers may retry the whole operation.
 *
 * @author Deadpool Team
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
