package com.bo.knowledge.config;

import com.bo.knowledge.model.Query;
import com.bo.knowledge.model.QuestionType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routing lexicon
 * Weighted keyword tables per tool, question-type phrases, the location gazetteer
 * and the tool priority order. Immutable, built once at startup.
 *
 * All phrases are stored in normalized form (see {@link Query#normalize(String)}).
 * A keyword ending in " in" (e.g. "hospitals in") is location-qualified and is used
 * to break ties when the query mentions a place.
 */
public final class Lexicon {

    private static final String LOCATION_QUALIFIER_SUFFIX = " in";

    private final Map<String, Map<String, Double>> toolKeywords;
    private final Map<QuestionType, List<String>> questionPatterns;
    private final Map<String, String> gazetteer;
    private final Map<String, String> regions;
    private final List<String> toolPriority;
    private final String fallbackTool;
    private final double positionalBonus;

    private Lexicon(Builder builder) {
        Map<String, Map<String, Double>> tools = new LinkedHashMap<>();
        builder.toolKeywords.forEach((tool, keywords) ->
                tools.put(tool, Collections.unmodifiableMap(new LinkedHashMap<>(keywords))));
        this.toolKeywords = Collections.unmodifiableMap(tools);

        Map<QuestionType, List<String>> patterns = new LinkedHashMap<>();
        builder.questionPatterns.forEach((type, phrases) -> patterns.put(type, List.copyOf(phrases)));
        this.questionPatterns = Collections.unmodifiableMap(patterns);

        this.gazetteer = Collections.unmodifiableMap(new LinkedHashMap<>(builder.gazetteer));
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.regions));
        this.toolPriority = List.copyOf(builder.toolPriority);
        this.fallbackTool = builder.fallbackTool;
        this.positionalBonus = builder.positionalBonus;

        if (fallbackTool == null || !toolKeywords.containsKey(fallbackTool)) {
            throw new IllegalStateException("Fallback tool must be one of the declared tools: " + fallbackTool);
        }
        for (String tool : toolPriority) {
            if (!toolKeywords.containsKey(tool)) {
                throw new IllegalStateException("Priority lists an undeclared tool: " + tool);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Tools in declaration order
     */
    public List<String> tools() {
        return List.copyOf(toolKeywords.keySet());
    }

    public Map<String, Double> keywordsOf(String tool) {
        return toolKeywords.getOrDefault(tool, Collections.emptyMap());
    }

    /**
     * Question-type phrases in detection priority order
     */
    public Map<QuestionType, List<String>> questionPatterns() {
        return questionPatterns;
    }

    /**
     * Normalized place name to display name
     * Alternative spellings map to the display name of the place they spell.
     */
    public Map<String, String> gazetteer() {
        return gazetteer;
    }

    /**
     * Whether a place lies in, or is, another place
     * "Old Dhaka" lies in "Dhaka". Both arguments are normalized names.
     */
    public boolean isWithin(String place, String area) {
        String current = place;
        // bounded in case of a cycle
        for (int depth = 0; current != null && depth <= regions.size(); depth++) {
            if (current.equals(area)) {
                return true;
            }
            current = regions.get(current);
        }
        return false;
    }

    public List<String> toolPriority() {
        return toolPriority;
    }

    public String fallbackTool() {
        return fallbackTool;
    }

    public double positionalBonus() {
        return positionalBonus;
    }

    public static boolean isLocationQualified(String keyword) {
        return keyword.endsWith(LOCATION_QUALIFIER_SUFFIX);
    }

    public static final class Builder {

        private final Map<String, Map<String, Double>> toolKeywords = new LinkedHashMap<>();
        private final Map<QuestionType, List<String>> questionPatterns = new LinkedHashMap<>();
        private final Map<String, String> gazetteer = new LinkedHashMap<>();
        private final Map<String, String> regions = new LinkedHashMap<>();
        private final List<String> toolPriority = new ArrayList<>();
        private String fallbackTool;
        private double positionalBonus = 0.25;

        private Builder() {
        }

        public Builder keywords(String tool, double weight, String... phrases) {
            Map<String, Double> keywords = toolKeywords.computeIfAbsent(tool, t -> new LinkedHashMap<>());
            for (String phrase : phrases) {
                String normalized = Query.normalize(phrase);
                if (!normalized.isEmpty()) {
                    keywords.put(normalized, weight);
                }
            }
            return this;
        }

        public Builder questionPattern(QuestionType type, String... phrases) {
            List<String> list = questionPatterns.computeIfAbsent(type, t -> new ArrayList<>());
            for (String phrase : phrases) {
                String normalized = Query.normalize(phrase);
                if (!normalized.isEmpty()) {
                    list.add(normalized);
                }
            }
            return this;
        }

        public Builder places(String... displayNames) {
            for (String name : displayNames) {
                String normalized = Query.normalize(name);
                if (!normalized.isEmpty()) {
                    gazetteer.putIfAbsent(normalized, name);
                }
            }
            return this;
        }

        /**
         * A place with its alternative spellings, all reported as {@code displayName}
         */
        public Builder place(String displayName, String... aliases) {
            places(displayName);
            for (String alias : aliases) {
                String normalized = Query.normalize(alias);
                if (!normalized.isEmpty()) {
                    gazetteer.putIfAbsent(normalized, displayName);
                }
            }
            return this;
        }

        /**
         * Places lying in a larger area, e.g. neighbourhoods of a city
         */
        public Builder within(String area, String... displayNames) {
            places(area);
            places(displayNames);
            String parent = Query.normalize(area);
            for (String name : displayNames) {
                String normalized = Query.normalize(name);
                if (!normalized.isEmpty() && !normalized.equals(parent)) {
                    regions.put(normalized, parent);
                }
            }
            return this;
        }

        public Builder priority(String... tools) {
            toolPriority.clear();
            toolPriority.addAll(List.of(tools));
            return this;
        }

        public Builder fallbackTool(String tool) {
            this.fallbackTool = tool;
            return this;
        }

        public Builder positionalBonus(double bonus) {
            this.positionalBonus = bonus;
            return this;
        }

        public Lexicon build() {
            return new Lexicon(this);
        }
    }
}
