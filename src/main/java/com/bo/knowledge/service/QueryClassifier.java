package com.bo.knowledge.service;

import com.bo.knowledge.config.Lexicon;
import com.bo.knowledge.model.Query;
import com.bo.knowledge.model.QuestionType;
import com.bo.knowledge.model.RoutingDecision;
import com.bo.knowledge.model.ToolRecommendation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query classifier
 * Scores every tool against the query with the lexicon, detects question type and
 * location, and picks the primary tool. Pure: the same text always yields an equal decision.
 */
@Slf4j
@Service
public class QueryClassifier {

    /**
     * Routing confidence bounds for a query that matched at least one keyword
     */
    private static final double MIN_CONFIDENCE = 0.05;
    private static final double MAX_CONFIDENCE = 0.95;

    /**
     * Scores closer than this are a tie
     */
    private static final double TIE_EPSILON = 1e-9;

    private final Lexicon lexicon;

    public QueryClassifier(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    public RoutingDecision classify(String text) {
        return classify(Query.of(text));
    }

    /**
     * Classify a query
     * Never throws; an empty query goes to the fallback tool with zero confidence
     */
    public RoutingDecision classify(Query query) {
        String text = query == null ? "" : query.getNormalized();

        // 1. score every tool
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, List<String>> matched = new LinkedHashMap<>();
        for (String tool : lexicon.tools()) {
            List<String> hits = new ArrayList<>();
            scores.put(tool, scoreTool(text, tool, hits));
            matched.put(tool, Collections.unmodifiableList(hits));
        }

        // 2. question type and location are detected independently of scoring
        QuestionType questionType = detectQuestionType(text);
        String location = detectLocation(text);
        boolean hasLocation = location != null;

        // 3. pick the winner
        String primaryTool = pickPrimaryTool(scores, matched, hasLocation);

        // 4. confidence from the score distribution
        double total = scores.values().stream().mapToDouble(Double::doubleValue).sum();
        double confidence;
        if (total <= 0) {
            confidence = 0.0;
        } else {
            confidence = clamp(scores.get(primaryTool) / total, MIN_CONFIDENCE, MAX_CONFIDENCE);
        }

        RoutingDecision decision = new RoutingDecision(
                primaryTool,
                confidence,
                questionType,
                hasLocation,
                location,
                Collections.unmodifiableMap(scores),
                Collections.unmodifiableMap(matched),
                text);

        log.debug("Query classified - Query: '{}', Tool: {}, Confidence: {}, Type: {}, Location: {}, Scores: {}",
                text, primaryTool, String.format("%.2f", confidence), questionType.label(), location, scores);
        return decision;
    }

    /**
     * Tools with a non-zero score, best first
     */
    public List<ToolRecommendation> recommend(Query query) {
        RoutingDecision decision = classify(query);
        double total = decision.totalScore();
        List<ToolRecommendation> recommendations = new ArrayList<>();
        decision.getToolScores().forEach((tool, score) -> {
            if (score > 0) {
                recommendations.add(new ToolRecommendation(tool, score, score / total));
            }
        });
        // stable sort keeps declaration order among equal shares
        recommendations.sort(Comparator.comparingDouble(ToolRecommendation::getConfidence).reversed());
        return recommendations;
    }

    private double scoreTool(String text, String tool, List<String> hits) {
        if (text.isEmpty()) {
            return 0.0;
        }
        double score = 0.0;
        for (Map.Entry<String, Double> keyword : lexicon.keywordsOf(tool).entrySet()) {
            if (!KeywordMatcher.contains(text, keyword.getKey())) {
                continue;
            }
            score += keyword.getValue();
            if (KeywordMatcher.inLeadingThird(text, keyword.getKey())) {
                score += lexicon.positionalBonus();
            }
            hits.add(keyword.getKey());
        }
        return score;
    }

    private QuestionType detectQuestionType(String text) {
        if (text.isEmpty()) {
            return QuestionType.GENERAL;
        }
        for (Map.Entry<QuestionType, List<String>> pattern : lexicon.questionPatterns().entrySet()) {
            for (String phrase : pattern.getValue()) {
                if (KeywordMatcher.contains(text, phrase)) {
                    return pattern.getKey();
                }
            }
        }
        return QuestionType.GENERAL;
    }

    /**
     * Longest matching gazetteer entry wins, earliest occurrence breaks ties
     */
    private String detectLocation(String text) {
        if (text.isEmpty()) {
            return null;
        }
        String best = null;
        int bestLength = -1;
        int bestOffset = Integer.MAX_VALUE;
        for (Map.Entry<String, String> place : lexicon.gazetteer().entrySet()) {
            int offset = KeywordMatcher.indexOf(text, place.getKey());
            if (offset < 0) {
                continue;
            }
            int length = place.getKey().length();
            if (length > bestLength || (length == bestLength && offset < bestOffset)) {
                best = place.getValue();
                bestLength = length;
                bestOffset = offset;
            }
        }
        return best;
    }

    private String pickPrimaryTool(Map<String, Double> scores, Map<String, List<String>> matched, boolean hasLocation) {
        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (max <= 0) {
            return lexicon.fallbackTool();
        }

        List<String> tied = new ArrayList<>();
        scores.forEach((tool, score) -> {
            if (Math.abs(score - max) < TIE_EPSILON) {
                tied.add(tool);
            }
        });
        if (tied.size() == 1) {
            return tied.get(0);
        }

        // a) a location-qualified keyword ("hospitals in") names the domain the place belongs to
        List<String> candidates = tied;
        if (hasLocation) {
            List<String> qualified = new ArrayList<>();
            for (String tool : tied) {
                if (matched.get(tool).stream().anyMatch(Lexicon::isLocationQualified)) {
                    qualified.add(tool);
                }
            }
            if (!qualified.isEmpty()) {
                candidates = qualified;
            }
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        // b) fixed priority order
        for (String tool : lexicon.toolPriority()) {
            if (candidates.contains(tool)) {
                return tool;
            }
        }

        // c) declaration order
        return candidates.get(0);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
