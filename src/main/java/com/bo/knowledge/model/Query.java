package com.bo.knowledge.model;

import lombok.Data;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * User query
 * Keeps the original text for display and a normalized form for matching
 */
@Data
public final class Query {

    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    /**
     * Trimmed original text
     */
    private final String original;

    /**
     * Lowercased text containing only letters, digits and single spaces
     */
    private final String normalized;

    public static Query of(String text) {
        String original = text == null ? "" : text.trim();
        return new Query(original, normalize(original));
    }

    /**
     * Normalize text for keyword matching
     * "Cox's Bazar, Bangladesh!" becomes "coxs bazar bangladesh"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        lower = APOSTROPHES.matcher(lower).replaceAll("");
        return NON_WORD.matcher(lower).replaceAll(" ").trim();
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }
}
