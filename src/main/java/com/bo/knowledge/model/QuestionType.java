package com.bo.knowledge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Question type detected from the query phrasing
 */
public enum QuestionType {
    COUNT,
    LIST,
    COMPARISON,
    FILTER,
    GENERAL;

    /**
     * Filter and comparison questions need more interpretation than plain lookups
     */
    public boolean isComplex() {
        return this == FILTER || this == COMPARISON;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
