package com.bo.knowledge.model;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Routing decision
 * Output of the query classifier, immutable once produced
 */
@Data
public final class RoutingDecision {

    /**
     * Tool with the highest score after tie-breaking
     */
    private final String primaryTool;

    /**
     * Share of the total score held by the primary tool, in [0, 1]
     */
    private final double confidence;

    private final QuestionType questionType;

    private final boolean hasLocation;

    /**
     * Display name of the detected location, null when none was found
     */
    private final String location;

    /**
     * Score of every candidate tool, in tool declaration order
     */
    private final Map<String, Double> toolScores;

    /**
     * Keywords that contributed to each tool's score
     */
    private final Map<String, List<String>> matchedKeywords;

    private final String normalizedQuery;

    public double scoreOf(String tool) {
        Double score = toolScores.get(tool);
        return score == null ? 0.0 : score;
    }

    public double totalScore() {
        return toolScores.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
