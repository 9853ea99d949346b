package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The player currently entitled to draft. Advisory only: may be stale by one pick
 * under concurrent drafting.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NextDrafter {

    private String playerId;
    private String playerName;
    private int draftPosition;
    private int totalPicks;
    private int activePicks;
    private int maxPicks;
}
