package com.bo.knowledge.model;

import lombok.Data;

/**
 * Final result confidence
 */
@Data
public final class ConfidenceResult {

    /**
     * Score in [0.00, 0.95], two decimals
     */
    private final double value;

    private final ConfidenceBand band;

    /**
     * Penalty subtracted for incomplete answer text
     */
    private final double completenessPenalty;

    public String getCategory() {
        if (value >= 0.90) {
            return "High confidence - Simple deterministic query";
        } else if (value >= 0.80) {
            return "Good confidence - Moderate query";
        } else if (value >= 0.70) {
            return "Medium confidence - Web-based info or minor ambiguity";
        } else if (value >= 0.50) {
            return "Low confidence - Fallback used or partial uncertainty";
        }
        return "Very low confidence - Execution errors or high ambiguity";
    }
}
