package com.cred.freestyle.deadpool.service.transition;

/**
 * Stages of a season transition, in execution order.
 *
 * @author Deadpool Team
 */
public enum TransitionStage {
    COMPUTE_OUTGOING_LEADERBOARD,
    BUILD_DRAFT_ORDER,
    CARRY_FORWARD_PICKS,
    RECORD_CAPACITY,
    VALIDATE,
    FINALIZE
}
