package com.bo.knowledge.service;

import com.bo.knowledge.model.ConfidenceBand;
import com.bo.knowledge.model.ConfidenceResult;
import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.RoutingDecision;
import com.bo.knowledge.model.ToolNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Confidence scorer
 * The execution outcome picks a band, the routing confidence places the score inside it.
 *
 * Bands:
 * - clean lookup:            0.80 - 0.95
 * - filter/comparison:       0.70 - 0.89
 * - fallback answer:         0.50 - 0.79
 * - failed or empty:         0.00 - 0.49
 */
@Slf4j
@Component
public class ConfidenceScorer {

    /**
     * The system never reports full certainty
     */
    public static final double MAX_CONFIDENCE = 0.95;

    private static final double MIN_CONFIDENCE = 0.00;

    /**
     * Direct web-search answers stay below database answers
     */
    private static final double WEB_SEARCH_CEILING = 0.80;

    /**
     * Completeness penalties
     */
    private static final double UNKNOWN_PENALTY = 0.02;
    private static final double ERROR_MARKER_PENALTY = 0.03;
    private static final double MAX_COMPLETENESS_PENALTY = 0.05;

    private static final List<String> ERROR_MARKERS = List.of("error", "failed", "exception");

    public ConfidenceResult score(RoutingDecision decision, ExecutionOutcome outcome) {
        ConfidenceBand band = selectBand(decision, outcome);
        double routing = decision == null ? 0.0 : decision.getConfidence();

        double value = band.interpolate(routing);

        double penalty = 0.0;
        if (band != ConfidenceBand.FAILED) {
            penalty = completenessPenalty(outcome.getRawResult());
            // penalties never push a score out of its band
            value = Math.max(band.low(), value - penalty);
        }

        if (decision != null && ToolNames.WEB_SEARCH.equals(decision.getPrimaryTool())
                && outcome != null && !outcome.isUsedFallback()) {
            value = Math.min(value, WEB_SEARCH_CEILING);
        }

        double finalValue = clamp(round(value));
        log.debug("Confidence scored - Band: {}, Routing: {}, Penalty: {}, Final: {}",
                band, routing, penalty, finalValue);
        return new ConfidenceResult(finalValue, band, penalty);
    }

    /**
     * Band for an outcome
     */
    public ConfidenceBand selectBand(RoutingDecision decision, ExecutionOutcome outcome) {
        if (outcome == null || !outcome.isSuccess()) {
            return ConfidenceBand.FAILED;
        }
        if (outcome.isUsedFallback()) {
            return ConfidenceBand.FALLBACK;
        }
        if (outcome.isResultEmpty()) {
            return ConfidenceBand.FAILED;
        }
        if (decision != null && decision.getQuestionType().isComplex()) {
            return ConfidenceBand.COMPLEX;
        }
        return ConfidenceBand.CLEAN;
    }

    /**
     * Penalty for answers that admit missing data or carry error text
     */
    double completenessPenalty(String answer) {
        if (answer == null || answer.isEmpty()) {
            return 0.0;
        }
        String lower = answer.toLowerCase(Locale.ROOT);
        double penalty = 0.0;
        if (lower.contains("unknown")) {
            penalty += UNKNOWN_PENALTY;
        }
        for (String marker : ERROR_MARKERS) {
            if (lower.contains(marker)) {
                penalty += ERROR_MARKER_PENALTY;
                break;
            }
        }
        return Math.min(penalty, MAX_COMPLETENESS_PENALTY);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static double clamp(double value) {
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, value));
    }
}
