package com.cred.freestyle.deadpool.api.dto;

/**
 * Response DTO for a single player's score.
 *
 * @author Deadpool Team
 */
public class ScoreResponse {

    private final String playerId;
    private final int year;
    private final int score;

    public ScoreResponse(String playerId, int year, int score) {
        this.playerId = playerId;
        this.year = year;
        this.score = score;
    }

    public String getPlayerId() {
        return playerId;
    }

    public int getYear() {
        return year;
    }

    public int getScore() {
        return score;
    }
}
