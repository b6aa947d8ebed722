package com.bo.knowledge.service;

/**
 * Keyword matcher
 * Whole-word and whole-phrase matching over normalized query text,
 * so "rated" never matches the keyword "rate"
 */
public final class KeywordMatcher {

    private KeywordMatcher() {
    }

    /**
     * Character offset of the first whole-phrase occurrence, -1 if absent
     *
     * @param text   normalized text (single spaces, no punctuation)
     * @param phrase normalized phrase
     */
    public static int indexOf(String text, String phrase) {
        if (text == null || phrase == null || text.isEmpty() || phrase.isEmpty()) {
            return -1;
        }
        String padded = " " + text + " ";
        int idx = padded.indexOf(" " + phrase + " ");
        // padded offset idx points at the leading space, which is offset idx in the original text
        return idx;
    }

    public static boolean contains(String text, String phrase) {
        return indexOf(text, phrase) >= 0;
    }

    /**
     * Index of the token where the first occurrence of the phrase starts, -1 if absent
     */
    public static int tokenIndexOf(String text, String phrase) {
        int offset = indexOf(text, phrase);
        if (offset < 0) {
            return -1;
        }
        int tokens = 0;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == ' ') {
                tokens++;
            }
        }
        return tokens;
    }

    public static int tokenCount(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ' ') {
                count++;
            }
        }
        return count;
    }

    /**
     * Whether the phrase starts within the first third of the text's tokens
     */
    public static boolean inLeadingThird(String text, String phrase) {
        int tokenIndex = tokenIndexOf(text, phrase);
        if (tokenIndex < 0) {
            return false;
        }
        int leading = (tokenCount(text) + 2) / 3;
        return tokenIndex < leading;
    }
}
