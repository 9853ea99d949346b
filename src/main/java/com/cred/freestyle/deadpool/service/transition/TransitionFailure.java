package com.cred.freestyle.deadpool.service.transition;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A per-player write that could not be applied. Other players are unaffected.
 *
 * @author Deadpool Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransitionFailure {

    private String playerId;
    private TransitionStage stage;
    private String message;
}
