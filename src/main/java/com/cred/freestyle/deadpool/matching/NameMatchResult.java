package com.cred.freestyle.deadpool.matching;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of comparing two candidate names.
 *
 * @author Deadpool Team
 */
@Data
@AllArgsConstructor
public class NameMatchResult {

    private boolean match;

    /**
     * Similarity in [0, 1]; 1.0 for identical normalized names.
     */
    private double score;

    private String normalizedA;
    private String normalizedB;

    public boolean isExact() {
        return normalizedA.equals(normalizedB);
    }
}
