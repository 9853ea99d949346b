package com.cred.freestyle.deadpool.service.transition;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Timing and item count of one completed stage.
 *
 * @author Deadpool Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StageResult {

    private TransitionStage stage;
    private long durationMs;
    private int itemsProcessed;

    /**
     * True when the stage computed its writes but did not apply them.
     */
    private boolean writesSkipped;
}
