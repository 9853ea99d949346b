package com.cred.freestyle.deadpool.infrastructure.messaging.events;

import java.time.Instant;

/**
 * Event emitted when a pick is committed.
 * Consumed by the notification service to tell players who drafted whom.
 *
 * @author Deadpool Team
 */
public class DraftEvent {

    private EventType eventType;
    private String playerId;
    private int year;
    private String candidateId;
    private String candidateName;
    private boolean newCandidate;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public DraftEvent() {
    }

    public DraftEvent(String playerId, int year, String candidateId, String candidateName,
                      boolean newCandidate, Instant timestamp) {
        this.eventType = EventType.PICK_COMMITTED;
        this.playerId = playerId;
        this.year = year;
        this.candidateId = candidateId;
        this.candidateName = candidateName;
        this.newCandidate = newCandidate;
        this.timestamp = timestamp;
    }

    // Getters and setters
    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public int getYear() {
        return year;
    }

    public void setYear(int year) {
        this.year = year;
    }

    public String getCandidateId() {
        return candidateId;
    }

    public void setCandidateId(String candidateId) {
        this.candidateId = candidateId;
    }

    public String getCandidateName() {
        return candidateName;
    }

    public void setCandidateName(String candidateName) {
        this.candidateName = candidateName;
    }

    public boolean isNewCandidate() {
        return newCandidate;
    }

    public void setNewCandidate(boolean newCandidate) {
        this.newCandidate = newCandidate;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public enum EventType {
        PICK_COMMITTED
    }
}
