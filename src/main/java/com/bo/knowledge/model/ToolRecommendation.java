package com.bo.knowledge.model;

import lombok.Data;

/**
 * A candidate tool with its share of the routing score
 */
@Data
public final class ToolRecommendation {
    private final String tool;
    private final double score;
    private final double confidence;
}
