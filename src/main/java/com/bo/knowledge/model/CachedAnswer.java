package com.bo.knowledge.model;

import lombok.Data;

/**
 * Cached answer payload, stored as JSON in the result cache
 */
@Data
public final class CachedAnswer {
    private final String response;
    private final double resultConfidence;
    private final String confidenceCategory;
    private final String sqlText;
    private final String toolUsed;
}
