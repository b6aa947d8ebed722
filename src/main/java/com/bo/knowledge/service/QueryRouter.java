package com.bo.knowledge.service;

import com.bo.knowledge.model.AnswerResult;
import com.bo.knowledge.model.CacheEntry;
import com.bo.knowledge.model.CacheStats;
import com.bo.knowledge.model.CachedAnswer;
import com.bo.knowledge.model.ConfidenceResult;
import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;
import com.bo.knowledge.model.RoutingDecision;
import com.bo.knowledge.model.ToolRecommendation;
import com.bo.knowledge.tool.ToolExecutor;
import com.bo.knowledge.tool.ToolRegistry;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Query router
 * Classifies a query, serves it from the result cache or runs the chosen tool
 * with a timeout, scores the outcome and caches usable answers.
 */
@Slf4j
@Service
public class QueryRouter {

    private final QueryClassifier classifier;
    private final ConfidenceScorer scorer;
    private final ResultCache cache;
    private final ToolRegistry tools;
    private final boolean cacheEnabled;
    private final Duration defaultTimeout;

    private final Gson gson = new Gson();

    private final ExecutorService toolExecutor;

    public QueryRouter(QueryClassifier classifier,
                       ConfidenceScorer scorer,
                       ResultCache cache,
                       ToolRegistry tools,
                       @Value("${agent.cache.enabled:true}") boolean cacheEnabled,
                       @Value("${agent.router.tool-timeout-seconds:30}") long timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        this.classifier = classifier;
        this.scorer = scorer;
        this.cache = cache;
        this.tools = tools;
        this.cacheEnabled = cacheEnabled;
        this.defaultTimeout = Duration.ofSeconds(timeoutSeconds);

        AtomicInteger threadCount = new AtomicInteger();
        this.toolExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        toolExecutor.shutdownNow();
        log.info("Query router stopped");
    }

    public RoutingDecision route(String text) {
        return classifier.classify(Query.of(text));
    }

    public AnswerResult answer(String text) {
        return answer(text, defaultTimeout);
    }

    /**
     * Answer a query
     * Tool failures and timeouts come back as a low-confidence answer, never as an exception.
     */
    public AnswerResult answer(String text, Duration timeout) {
        long startTime = System.currentTimeMillis();
        Query query = Query.of(text);
        RoutingDecision decision = classifier.classify(query);
        String tool = decision.getPrimaryTool();

        // 1. cache
        if (cacheEnabled) {
            AnswerResult cached = fromCache(query, decision, startTime);
            if (cached != null) {
                logSummary(cached);
                return cached;
            }
        }

        // 2. run the tool
        ExecutionOutcome outcome = execute(tool, query, timeout == null ? defaultTimeout : timeout);
        ConfidenceResult confidence = scorer.score(decision, outcome);

        String response = outcome.isSuccess()
                ? outcome.getRawResult()
                : "Sorry, I could not find an answer to your question. Reason: " + outcome.getRawResult();

        // 3. only usable answers are cached
        if (cacheEnabled && outcome.isUsable()) {
            CachedAnswer payload = new CachedAnswer(response, confidence.getValue(),
                    confidence.getCategory(), outcome.getSqlText(), tool);
            try {
                cache.set(query.getNormalized(), tool, gson.toJson(payload));
            } catch (RuntimeException e) {
                log.warn("Answer not cached - Query: '{}', Error: {}", query.getOriginal(), e.getMessage());
            }
        }

        AnswerResult result = new AnswerResult(
                query.getOriginal(),
                response,
                tool,
                decision.getConfidence(),
                confidence.getValue(),
                confidence.getCategory(),
                decision.getQuestionType(),
                decision.getLocation(),
                outcome.getSqlText(),
                false,
                0,
                System.currentTimeMillis() - startTime);
        logSummary(result);
        return result;
    }

    /**
     * Answer every question in a multi-question input
     * "How many universities are in Dhaka? What is the healthcare policy?" yields two answers.
     */
    public List<AnswerResult> answerAll(String text) {
        List<AnswerResult> results = new ArrayList<>();
        if (text == null) {
            return results;
        }
        for (String part : text.split("\\?")) {
            String question = part.trim();
            if (!Query.normalize(question).isEmpty()) {
                results.add(answer(question + "?"));
            }
        }
        return results;
    }

    /**
     * Human-readable routing explanation
     */
    public String explainRouting(String text) {
        RoutingDecision decision = route(text);
        StringBuilder sb = new StringBuilder();
        sb.append("Query: ").append(text == null ? "" : text.trim()).append("\n");
        sb.append("Primary tool: ").append(decision.getPrimaryTool()).append("\n");
        sb.append("Confidence: ").append(String.format("%.2f", decision.getConfidence())).append("\n");
        sb.append("Question type: ").append(decision.getQuestionType().label()).append("\n");
        sb.append("Location: ").append(decision.isHasLocation() ? decision.getLocation() : "none").append("\n");
        sb.append("Tool scores:\n");
        for (Map.Entry<String, Double> score : decision.getToolScores().entrySet()) {
            sb.append("  ").append(score.getKey()).append(": ")
                    .append(String.format("%.2f", score.getValue()));
            List<String> matched = decision.getMatchedKeywords().get(score.getKey());
            if (matched != null && !matched.isEmpty()) {
                sb.append(" ").append(matched);
            }
            sb.append("\n");
        }
        return sb.toString().trim();
    }

    public List<ToolRecommendation> recommendTools(String text) {
        return classifier.recommend(Query.of(text));
    }

    // ========== Cache administration ==========

    public CacheStats cacheStats() {
        return cache.statistics();
    }

    public int cacheClearAll() {
        return cache.clearAll();
    }

    public int cacheClearExpired() {
        return cache.invalidateExpired();
    }

    public boolean cacheInvalidate(String text, String tool) {
        return cache.invalidate(Query.normalize(text), tool);
    }

    private AnswerResult fromCache(Query query, RoutingDecision decision, long startTime) {
        String tool = decision.getPrimaryTool();
        CacheEntry entry;
        try {
            entry = cache.get(query.getNormalized(), tool);
        } catch (RuntimeException e) {
            log.warn("Cache read failed, computing answer - Query: '{}', Error: {}", query.getOriginal(), e.getMessage());
            return null;
        }
        if (entry == null) {
            return null;
        }

        CachedAnswer payload;
        try {
            payload = gson.fromJson(entry.getValue(), CachedAnswer.class);
        } catch (JsonParseException e) {
            payload = null;
        }
        if (payload == null || payload.getResponse() == null) {
            log.warn("Undecodable cache entry dropped - Key: {}", entry.getKey());
            cache.invalidate(query.getNormalized(), tool);
            return null;
        }

        return new AnswerResult(
                query.getOriginal(),
                payload.getResponse(),
                tool,
                decision.getConfidence(),
                payload.getResultConfidence(),
                payload.getConfidenceCategory(),
                decision.getQuestionType(),
                decision.getLocation(),
                payload.getSqlText(),
                true,
                entry.getHitCount(),
                System.currentTimeMillis() - startTime);
    }

    private ExecutionOutcome execute(String toolName, Query query, Duration timeout) {
        ToolExecutor executor = tools.get(toolName);
        if (executor == null) {
            log.error("No tool registered - Tool: {}", toolName);
            return ExecutionOutcome.failure("Unknown tool: " + toolName);
        }

        Future<ExecutionOutcome> future = toolExecutor.submit(() -> executor.run(query));
        try {
            ExecutionOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome == null ? ExecutionOutcome.failure(toolName + " returned nothing") : outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool timed out - Tool: {}, Timeout: {}ms, Query: '{}'",
                    toolName, timeout.toMillis(), query.getOriginal());
            return ExecutionOutcome.failure(toolName + " timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Tool failed - Tool: {}, Query: '{}'", toolName, query.getOriginal(), cause);
            return ExecutionOutcome.failure(toolName + " failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failure(toolName + " was interrupted");
        }
    }

    private void logSummary(AnswerResult result) {
        log.info("Query answered - Query: '{}', Tool: {}, Type: {}, Routing: {}, Result: {}, Cached: {}, Time: {}ms",
                result.getQuery(),
                result.getToolUsed(),
                result.getQuestionType().label(),
                String.format("%.2f", result.getRoutingConfidence()),
                String.format("%.2f", result.getResultConfidence()),
                result.isCached(),
                result.getExecutionTimeMs());
    }
}
