package com.cred.freestyle.deadpool.exception;

/**
 * Exception thrown when a player already holds the maximum number of active picks for the year.
 *
 * @author Deadpool Team
 */
public class CapacityExceededException extends DraftConflictException {

    private final String playerId;
    private final int year;
    private final int activePicks;
    private final int maxPicks;

    public CapacityExceededException(String playerId, int year, int activePicks, int maxPicks) {
        super(String.format("Player %s already has %d active picks for %d. Limit: %d",
                playerId, activePicks, year, maxPicks));
        this.playerId = playerId;
        this.year = year;
        this.activePicks = activePicks;
        this.maxPicks = maxPicks;
    }

    @Override
    public String getReason() {
        return "CAPACITY_EXCEEDED";
    }

    public String getPlayerId() {
        return playerId;
    }

    public int getYear() {
        return year;
    }

    public int getActivePicks() {
        return activePicks;
    }

    public int getMaxPicks() {
        return maxPicks;
    }
}
