package com.cred.freestyle.deadpool.exception;

/**
 * Exception thrown when a draft order is initialized for a year that already has one.
 *
 * @author Deadpool Team
 */
public class DraftOrderExistsException extends DraftConflictException {

    private final int year;

    public DraftOrderExistsException(int year) {
        super(String.format("Draft order for %d already exists", year));
        this.year = year;
    }

    @Override
    public String getReason() {
        return "DRAFT_ORDER_EXISTS";
    }

    public int getYear() {
        return year;
    }
}
