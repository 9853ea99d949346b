package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A ranked row of a season leaderboard.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {

    private int rank;
    private String playerId;
    private String playerName;
    private int score;
    private int draftPosition;
}
