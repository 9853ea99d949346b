package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-player pick totals for a season.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickCount {

    private String playerId;
    private String playerName;
    private int draftPosition;
    private int totalPicks;
    private int activePicks;
    private int maxPicks;
    private int availableSlots;
}
