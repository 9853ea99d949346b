package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One slot of a season's draft order. Positions of a year form a contiguous 1..N.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftOrderEntry {

    private int year;
    private int position;
    private String playerId;
}
