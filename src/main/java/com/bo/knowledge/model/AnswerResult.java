package com.bo.knowledge.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer envelope returned for a query
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResult {

    private String query;

    /**
     * Answer text, or an explanation when no answer could be produced
     */
    private String response;

    private String toolUsed;

    private double routingConfidence;

    private double resultConfidence;

    private String confidenceCategory;

    private QuestionType questionType;

    private String location;

    private String sqlText;

    private boolean cached;

    /**
     * Hit count of the cache entry that served this answer, 0 when freshly computed
     */
    private long cacheHits;

    private long executionTimeMs;
}
