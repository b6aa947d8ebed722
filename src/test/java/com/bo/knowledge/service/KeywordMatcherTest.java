package com.bo.knowledge.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordMatcherTest {

    @Test
    void matchesWholeWordsOnly() {
        assertThat(KeywordMatcher.contains("top rated restaurants", "rated")).isTrue();
        assertThat(KeywordMatcher.contains("top rated restaurants", "rate")).isFalse();
        assertThat(KeywordMatcher.contains("universities in dhaka", "university")).isFalse();
    }

    @Test
    void matchesPhrases() {
        assertThat(KeywordMatcher.contains("hospitals in dhaka", "hospitals in")).isTrue();
        assertThat(KeywordMatcher.contains("hospitals are in dhaka", "hospitals in")).isFalse();
        assertThat(KeywordMatcher.indexOf("list hospitals in dhaka", "hospitals in")).isEqualTo(5);
    }

    @Test
    void tokenPositions() {
        String text = "how many universities are in dhaka";
        assertThat(KeywordMatcher.tokenCount(text)).isEqualTo(6);
        assertThat(KeywordMatcher.tokenIndexOf(text, "universities")).isEqualTo(2);
        assertThat(KeywordMatcher.inLeadingThird(text, "many")).isTrue();
        assertThat(KeywordMatcher.inLeadingThird(text, "universities")).isFalse();
        assertThat(KeywordMatcher.inLeadingThird(text, "missing")).isFalse();
    }

    @Test
    void emptyInputNeverMatches() {
        assertThat(KeywordMatcher.indexOf("", "a")).isEqualTo(-1);
        assertThat(KeywordMatcher.indexOf("abc", "")).isEqualTo(-1);
        assertThat(KeywordMatcher.tokenCount("")).isZero();
    }
}
