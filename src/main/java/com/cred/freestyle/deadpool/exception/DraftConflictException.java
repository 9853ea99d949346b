package com.cred.freestyle.deadpool.exception;

/**
 * Base class for draft rejections caused by the current state of the season
 * rather than by a malformed request. Mapped to 409 CONFLICT.
 *
 * @author Deadpool Team
 */
public abstract class DraftConflictException extends RuntimeException {

    protected DraftConflictException(String message) {
        super(message);
    }

    /**
     * Machine-readable reason, e.g. {@code ALREADY_DRAFTED}.
     */
    public abstract String getReason();
}
