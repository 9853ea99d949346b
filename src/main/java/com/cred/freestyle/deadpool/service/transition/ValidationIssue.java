package com.cred.freestyle.deadpool.service.transition;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A broken post-transition invariant. Player id is null for season-wide checks.
 *
 * @author Deadpool Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationIssue {

    private String playerId;
    private Check check;
    private String message;

    public enum Check {
        /** New-season pick count differs from the player's active outgoing picks. */
        PICK_COUNT,
        /** A candidate who died in the outgoing year was carried. */
        DECEASED_CARRIED,
        /** A candidate is held twice, by one player or by several. */
        DUPLICATE_PICK,
        /** Capacity record missing or inconsistent with the player's picks. */
        CAPACITY_RECORD,
        /** Draft order positions or players are not a 1..N permutation of the participants. */
        DRAFT_ORDER
    }
}
