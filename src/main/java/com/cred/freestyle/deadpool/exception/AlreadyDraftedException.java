package com.cred.freestyle.deadpool.exception;

/**
 * Exception thrown when a candidate has already been picked by some player for the year.
 * Each candidate may be held by at most one player per season.
 *
 * @author Deadpool Team
 */
public class AlreadyDraftedException extends DraftConflictException {

    private final String candidateId;
    private final String candidateName;
    private final int year;
    private final String holderPlayerId;

    public AlreadyDraftedException(String candidateId, String candidateName, int year, String holderPlayerId) {
        super(String.format("%s has already been drafted for %d", candidateName, year));
        this.candidateId = candidateId;
        this.candidateName = candidateName;
        this.year = year;
        this.holderPlayerId = holderPlayerId;
    }

    @Override
    public String getReason() {
        return "ALREADY_DRAFTED";
    }

    public String getCandidateId() {
        return candidateId;
    }

    public String getCandidateName() {
        return candidateName;
    }

    public int getYear() {
        return year;
    }

    public String getHolderPlayerId() {
        return holderPlayerId;
    }
}
