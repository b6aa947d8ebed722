package com.bo.knowledge.config;

import com.bo.knowledge.model.QuestionType;
import com.bo.knowledge.model.ToolNames;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexiconTest {

    @Test
    void defaultLexiconDeclaresEveryTool() {
        Lexicon lexicon = DefaultLexicon.create();

        assertThat(lexicon.tools()).containsExactly(
                ToolNames.INSTITUTIONS, ToolNames.HOSPITALS, ToolNames.RESTAURANTS, ToolNames.WEB_SEARCH);
        assertThat(lexicon.fallbackTool()).isEqualTo(ToolNames.WEB_SEARCH);
        assertThat(lexicon.questionPatterns().keySet()).containsExactly(
                QuestionType.COUNT, QuestionType.LIST, QuestionType.COMPARISON, QuestionType.FILTER);
        assertThat(lexicon.keywordsOf(ToolNames.WEB_SEARCH)).containsEntry("inflation", 3.0);
    }

    @Test
    void placesAreNormalized() {
        Lexicon lexicon = DefaultLexicon.create();

        assertThat(lexicon.gazetteer()).containsEntry("coxs bazar", "Cox's Bazar");
        assertThat(lexicon.gazetteer()).containsEntry("old dhaka", "Old Dhaka");
    }

    @Test
    void aliasesReportTheCurrentSpelling() {
        Lexicon lexicon = DefaultLexicon.create();

        assertThat(lexicon.gazetteer()).containsEntry("chittagong", "Chattogram");
        assertThat(lexicon.gazetteer()).containsEntry("chattogram", "Chattogram");
        assertThat(lexicon.gazetteer()).containsEntry("jessore", "Jashore");
    }

    @Test
    void neighbourhoodsLieWithinTheirCity() {
        Lexicon lexicon = DefaultLexicon.create();

        assertThat(lexicon.isWithin("old dhaka", "dhaka")).isTrue();
        assertThat(lexicon.isWithin("dhaka", "dhaka")).isTrue();
        assertThat(lexicon.isWithin("dhaka", "old dhaka")).isFalse();
        assertThat(lexicon.isWithin("chattogram", "dhaka")).isFalse();
    }

    @Test
    void locationQualifiedKeywords() {
        assertThat(Lexicon.isLocationQualified("hospitals in")).isTrue();
        assertThat(Lexicon.isLocationQualified("hospitals")).isFalse();
    }

    @Test
    void rejectsUndeclaredTools() {
        assertThatThrownBy(() -> Lexicon.builder().keywords("a", 1.0, "x").fallbackTool("b").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Lexicon.builder().keywords("a", 1.0, "x").fallbackTool("a").priority("a", "c").build())
                .isInstanceOf(IllegalStateException.class);
    }
}
