package com.bo.knowledge.tool;

import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;

/**
 * A query tool the router can delegate to
 */
public interface ToolExecutor {

    /**
     * Tool identifier, matches the lexicon's tool names
     */
    String name();

    /**
     * Answer the query
     * Implementations report failures through the outcome rather than by throwing.
     */
    ExecutionOutcome run(Query query);
}
