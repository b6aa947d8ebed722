package com.bo.knowledge.controller;

import com.bo.knowledge.model.AnswerResult;
import com.bo.knowledge.model.AskRequest;
import com.bo.knowledge.model.CacheStats;
import com.bo.knowledge.model.Result;
import com.bo.knowledge.model.RoutingDecision;
import com.bo.knowledge.model.ToolRecommendation;
import com.bo.knowledge.service.QueryRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Agent API controller
 * Question answering, routing inspection and cache administration
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class AgentController {

    private static final String BLANK_QUERY = "Query must not be empty";

    @Autowired
    private QueryRouter queryRouter;

    /**
     * Answer a question
     * POST /api/ask
     */
    @PostMapping("/ask")
    public Result<AnswerResult> ask(@RequestBody AskRequest request) {
        if (request == null || isBlank(request.getQuery())) {
            return Result.error(400, BLANK_QUERY);
        }
        if (request.getTimeoutSeconds() != null && request.getTimeoutSeconds() <= 0) {
            return Result.error(400, "timeoutSeconds must be positive");
        }
        log.info("Ask request - Query: {}", request.getQuery());

        try {
            AnswerResult answer = request.getTimeoutSeconds() == null
                    ? queryRouter.answer(request.getQuery())
                    : queryRouter.answer(request.getQuery(), Duration.ofSeconds(request.getTimeoutSeconds()));
            return Result.success(answer);
        } catch (Exception e) {
            log.error("Failed to answer query", e);
            return Result.error("System busy, please try again later");
        }
    }

    /**
     * Answer every question in the text
     * POST /api/ask/batch
     */
    @PostMapping("/ask/batch")
    public Result<List<AnswerResult>> askBatch(@RequestBody AskRequest request) {
        if (request == null || isBlank(request.getQuery())) {
            return Result.error(400, BLANK_QUERY);
        }
        try {
            return Result.success(queryRouter.answerAll(request.getQuery()));
        } catch (Exception e) {
            log.error("Failed to answer batch", e);
            return Result.error("System busy, please try again later");
        }
    }

    /**
     * GET /api/route?q=
     */
    @GetMapping("/route")
    public Result<RoutingDecision> route(@RequestParam("q") String query) {
        if (isBlank(query)) {
            return Result.error(400, BLANK_QUERY);
        }
        return Result.success(queryRouter.route(query));
    }

    @GetMapping("/route/explain")
    public Result<String> explain(@RequestParam("q") String query) {
        if (isBlank(query)) {
            return Result.error(400, BLANK_QUERY);
        }
        return Result.success(queryRouter.explainRouting(query));
    }

    @GetMapping("/route/recommendations")
    public Result<List<ToolRecommendation>> recommendations(@RequestParam("q") String query) {
        if (isBlank(query)) {
            return Result.error(400, BLANK_QUERY);
        }
        return Result.success(queryRouter.recommendTools(query));
    }

    // ========== Cache administration ==========

    @GetMapping("/cache/stats")
    public Result<CacheStats> cacheStats() {
        return Result.success(queryRouter.cacheStats());
    }

    @DeleteMapping("/cache")
    public Result<Integer> clearCache() {
        int removed = queryRouter.cacheClearAll();
        log.info("Cache cleared via API - Removed: {}", removed);
        return Result.success(removed);
    }

    @DeleteMapping("/cache/expired")
    public Result<Integer> clearExpired() {
        return Result.success(queryRouter.cacheClearExpired());
    }

    @DeleteMapping("/cache/entry")
    public Result<Boolean> invalidate(@RequestParam("q") String query, @RequestParam("tool") String tool) {
        if (isBlank(query) || isBlank(tool)) {
            return Result.error(400, "Query and tool must not be empty");
        }
        return Result.success(queryRouter.cacheInvalidate(query, tool));
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
