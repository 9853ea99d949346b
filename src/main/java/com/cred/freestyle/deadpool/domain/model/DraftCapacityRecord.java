package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached draft capacity of a player for a season.
 * Always reconcilable from the player's picks; never the source of truth for active counts.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftCapacityRecord {

    private String playerId;
    private int year;
    private int maxPicks;
    private int activePickCount;
    private int availableSlots;
    private Instant lastUpdated;

    public static DraftCapacityRecord of(String playerId, int year, int maxPicks, int activePickCount, Instant now) {
        return DraftCapacityRecord.builder()
                .playerId(playerId)
                .year(year)
                .maxPicks(maxPicks)
                .activePickCount(activePickCount)
                .availableSlots(Math.max(0, maxPicks - activePickCount))
                .lastUpdated(now)
                .build();
    }
}
