package com.cred.freestyle.deadpool.infrastructure.messaging.events;

import java.time.Instant;

/**
 * Event emitted when a season transition finishes (with or without validation issues).
 *
 * @author Deadpool Team
 */
public class SeasonTransitionEvent {

    private int fromYear;
    private int toYear;
    private String status;
    private int playersProcessed;
    private int picksCarried;
    private int picksRemoved;
    private int validationIssues;
    private Instant completedAt;

    public SeasonTransitionEvent() {
    }

    public SeasonTransitionEvent(int fromYear, int toYear, String status, int playersProcessed,
                                 int picksCarried, int picksRemoved, int validationIssues, Instant completedAt) {
        this.fromYear = fromYear;
        this.toYear = toYear;
        this.status = status;
        this.playersProcessed = playersProcessed;
        this.picksCarried = picksCarried;
        this.picksRemoved = picksRemoved;
        this.validationIssues = validationIssues;
        this.completedAt = completedAt;
    }

    public int getFromYear() {
        return fromYear;
    }

    public void setFromYear(int fromYear) {
        this.fromYear = fromYear;
    }

    public int getToYear() {
        return toYear;
    }

    public void setToYear(int toYear) {
        this.toYear = toYear;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public int getPlayersProcessed() {
        return playersProcessed;
    }

    public void setPlayersProcessed(int playersProcessed) {
        this.playersProcessed = playersProcessed;
    }

    public int getPicksCarried() {
        return picksCarried;
    }

    public void setPicksCarried(int picksCarried) {
        this.picksCarried = picksCarried;
    }

    public int getPicksRemoved() {
        return picksRemoved;
    }

    public void setPicksRemoved(int picksRemoved) {
        this.picksRemoved = picksRemoved;
    }

    public int getValidationIssues() {
        return validationIssues;
    }

    public void setValidationIssues(int validationIssues) {
        this.validationIssues = validationIssues;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
