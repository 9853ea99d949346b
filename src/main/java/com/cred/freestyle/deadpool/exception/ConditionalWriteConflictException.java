package com.cred.freestyle.deadpool.exception;

/**
 * Exception thrown when a conditional write loses to a concurrent writer
 * and the operation cannot be resolved by re-reading.
 *
 * @author Deadpool Team
 */
public class ConditionalWriteConflictException extends DraftConflictException {

    private final String key;

    public ConditionalWriteConflictException(String key, String message) {
        super(message);
        this.key = key;
    }

    @Override
    public String getReason() {
        return "WRITE_CONFLICT";
    }

    public String getKey() {
        return key;
    }
}
