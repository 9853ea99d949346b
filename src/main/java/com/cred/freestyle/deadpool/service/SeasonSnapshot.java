package com.cred.freestyle.deadpool.service;

import com.cred.freestyle.deadpool.domain.model.Candidate;
import com.cred.freestyle.deadpool.domain.model.DraftCapacityRecord;
import com.cred.freestyle.deadpool.domain.model.DraftOrderEntry;
import com.cred.freestyle.deadpool.domain.model.Pick;
import com.cred.freestyle.deadpool.domain.model.Player;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of one season: its draft order and, for every participating player,
 * the player's picks, their candidates and the capacity record.
 *
 * @author Deadpool Team
 */
public class SeasonSnapshot {

    private final int year;
    private final List<DraftOrderEntry> order;
    private final Map<String, List<Pick>> picksByPlayer;
    private final Map<String, Candidate> candidates;
    private final Map<String, Player> players;
    private final Map<String, DraftCapacityRecord> capacities;

    public SeasonSnapshot(int year,
                          List<DraftOrderEntry> order,
                          Map<String, List<Pick>> picksByPlayer,
                          Map<String, Candidate> candidates,
                          Map<String, Player> players,
                          Map<String, DraftCapacityRecord> capacities) {
        this.year = year;
        this.order = List.copyOf(order);
        this.picksByPlayer = Map.copyOf(picksByPlayer);
        this.candidates = Map.copyOf(candidates);
        this.players = Map.copyOf(players);
        this.capacities = Map.copyOf(capacities);
    }

    public int getYear() {
        return year;
    }

    /**
     * Draft order ascending by position.
     */
    public List<DraftOrderEntry> getOrder() {
        return order;
    }

    public List<Pick> getPicks(String playerId) {
        return picksByPlayer.getOrDefault(playerId, List.of());
    }

    public Candidate getCandidate(String candidateId) {
        return candidates.get(candidateId);
    }

    public String getPlayerName(String playerId) {
        Player player = players.get(playerId);
        return player == null ? playerId : player.getDisplayName();
    }

    /**
     * Picks whose candidate has no recorded death. Picks of unknown candidates count as active.
     */
    public int getActivePickCount(String playerId) {
        int active = 0;
        for (Pick pick : getPicks(playerId)) {
            Candidate candidate = candidates.get(pick.getCandidateId());
            if (candidate == null || !candidate.isDeceased()) {
                active++;
            }
        }
        return active;
    }

    /**
     * Max picks from the player's capacity record, or the default when none exists.
     */
    public int getMaxPicks(String playerId, int defaultMaxPicks) {
        DraftCapacityRecord record = capacities.get(playerId);
        return record == null ? defaultMaxPicks : record.getMaxPicks();
    }
}
