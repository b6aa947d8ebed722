package com.bo.knowledge.tool;

import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;
import lombok.extern.slf4j.Slf4j;

/**
 * Domain tool with a web-search fallback
 * When the domain tool fails or finds nothing, the fallback tool is asked instead
 * and its answer is reported as a fallback answer.
 */
@Slf4j
public class FallbackToolExecutor implements ToolExecutor {

    private final ToolExecutor primary;
    private final ToolExecutor fallback;

    public FallbackToolExecutor(ToolExecutor primary, ToolExecutor fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public String name() {
        return primary.name();
    }

    @Override
    public ExecutionOutcome run(Query query) {
        ExecutionOutcome outcome;
        try {
            outcome = primary.run(query);
        } catch (RuntimeException e) {
            log.error("Tool {} failed - Query: '{}'", primary.name(), query.getOriginal(), e);
            outcome = ExecutionOutcome.failure(primary.name() + " failed: " + e.getMessage());
        }
        if (outcome.isUsable()) {
            return outcome;
        }

        log.info("Tool {} returned no usable result, trying {} - Query: '{}'",
                primary.name(), fallback.name(), query.getOriginal());
        ExecutionOutcome secondary = fallback.run(query);
        if (secondary.isUsable()) {
            return secondary.asFallback();
        }

        log.warn("Fallback {} also failed - Query: '{}', Reason: {}",
                fallback.name(), query.getOriginal(), secondary.getRawResult());
        return outcome;
    }
}
