package com.bo.knowledge.model;

import lombok.Data;

/**
 * Outcome of running a tool against a query
 */
@Data
public final class ExecutionOutcome {

    private final boolean success;

    /**
     * True when a secondary tool answered after the primary one came up empty
     */
    private final boolean usedFallback;

    private final boolean resultEmpty;

    /**
     * Answer text on success, failure reason otherwise
     */
    private final String rawResult;

    /**
     * Query the tool executed, when it has one
     */
    private final String sqlText;

    public static ExecutionOutcome success(String rawResult, String sqlText) {
        return new ExecutionOutcome(true, false, false, rawResult, sqlText);
    }

    public static ExecutionOutcome empty(String rawResult, String sqlText) {
        return new ExecutionOutcome(true, false, true, rawResult, sqlText);
    }

    public static ExecutionOutcome failure(String reason) {
        return new ExecutionOutcome(false, false, true, reason, null);
    }

    /**
     * Mark a successful secondary-tool outcome as a fallback answer
     */
    public ExecutionOutcome asFallback() {
        return new ExecutionOutcome(success, true, resultEmpty, rawResult, sqlText);
    }

    /**
     * Whether there is something worth showing or caching
     */
    public boolean isUsable() {
        return success && !resultEmpty;
    }
}
