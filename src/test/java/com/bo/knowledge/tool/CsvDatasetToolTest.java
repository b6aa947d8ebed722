package com.bo.knowledge.tool;

import com.bo.knowledge.config.DefaultLexicon;
import com.bo.knowledge.config.Lexicon;
import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvDatasetToolTest {

    private static final Lexicon LEXICON = DefaultLexicon.create();

    private CsvDatasetTool institutions;
    private CsvDatasetTool restaurants;

    @BeforeEach
    void setUp() {
        institutions = new CsvDatasetTool("institutions", "data/test-institutions.csv", LEXICON,
                List.of("type", "public_private"), "students_count");
        institutions.load();
        restaurants = new CsvDatasetTool("restaurants", "data/test-restaurants.csv", LEXICON,
                List.of("cuisine", "price_range"), "rating");
        restaurants.load();
    }

    @Test
    void loadsRows() {
        assertThat(institutions.size()).isEqualTo(6);
        assertThat(institutions.name()).isEqualTo("institutions");
    }

    @Test
    void countsByLocationAndCategory() {
        ExecutionOutcome outcome = institutions.run(Query.of("How many universities are in Dhaka?"));

        assertThat(outcome.isUsable()).isTrue();
        assertThat(outcome.getRawResult()).isEqualTo("Found 3 institutions matching your criteria.");
        assertThat(outcome.getSqlText()).isEqualTo(
                "SELECT COUNT(*) FROM institutions WHERE location = 'Dhaka' AND type IN ('university')");
    }

    @Test
    void listsWithYearFilter() {
        ExecutionOutcome outcome = institutions.run(Query.of("List private universities established after 1990"));

        assertThat(outcome.getRawResult())
                .startsWith("Found 2 institutions:")
                .contains("North South University - University in Dhaka (Est. 1992)")
                .contains("BRAC University")
                .doesNotContain("University of Dhaka");
        assertThat(outcome.getSqlText()).contains("public_private IN ('private')").contains("established > 1990");
    }

    @Test
    void longestPlaceNameFilters() {
        ExecutionOutcome outcome = institutions.run(Query.of("Colleges in Old Dhaka"));

        assertThat(outcome.getRawResult())
                .startsWith("Found 1 result:")
                .contains("Notre Dame College");
    }

    @Test
    void numericThreshold() {
        ExecutionOutcome outcome = institutions.run(Query.of("Universities with more than 20000 students"));

        assertThat(outcome.getRawResult()).contains("University of Dhaka").contains("Chittagong University");
        assertThat(outcome.getSqlText()).contains("students_count > 20000");

        ExecutionOutcome rated = restaurants.run(Query.of("Restaurants rated above 4.1"));
        assertThat(rated.getRawResult()).contains("Haji Biryani").contains("Star Kabab").doesNotContain("Pizza Hut");
    }

    @Test
    void thresholdsWithThousandsSeparators() {
        ExecutionOutcome more = institutions.run(Query.of("Universities with more than 20,000 students"));

        assertThat(more.getSqlText()).contains("students_count > 20000");
        assertThat(more.getRawResult())
                .startsWith("Found 2 institutions:")
                .contains("University of Dhaka")
                .contains("Chittagong University");

        ExecutionOutcome fewer = institutions.run(Query.of("Institutions with fewer than 7,000 students"));

        assertThat(fewer.getSqlText()).contains("students_count < 7000");
        assertThat(fewer.getRawResult()).contains("BRAC University").contains("Dhaka Medical College")
                .doesNotContain("North South University");
    }

    @Test
    void alternativeSpellingFindsTheSamePlace() {
        ExecutionOutcome oldName = institutions.run(Query.of("How many universities are in Chittagong?"));
        ExecutionOutcome newName = institutions.run(Query.of("How many universities are in Chattogram?"));

        assertThat(oldName.isResultEmpty()).isFalse();
        assertThat(oldName.getRawResult()).isEqualTo("Found 1 result matching your criteria.");
        assertThat(oldName.getSqlText()).contains("location = 'Chattogram'");
        assertThat(newName.getRawResult()).isEqualTo(oldName.getRawResult());
    }

    @Test
    void cityIncludesItsNeighbourhoods() {
        ExecutionOutcome outcome = restaurants.run(Query.of("How many restaurants are in Dhaka?"));

        assertThat(outcome.getRawResult()).isEqualTo("Found 3 restaurants matching your criteria.");

        ExecutionOutcome listed = restaurants.run(Query.of("Restaurants in Dhaka"));
        assertThat(listed.getRawResult()).contains("Haji Biryani").doesNotContain("Golden Dragon");
    }

    @Test
    void countryNameDoesNotFilter() {
        ExecutionOutcome outcome = restaurants.run(Query.of("How many restaurants are in Bangladesh?"));

        assertThat(outcome.getRawResult()).isEqualTo("Found 4 restaurants matching your criteria.");
    }

    @Test
    void noMatchesIsAnEmptyResult() {
        ExecutionOutcome outcome = institutions.run(Query.of("Universities in Sylhet"));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isResultEmpty()).isTrue();
        assertThat(outcome.getRawResult()).isEqualTo("No institutions found matching your query.");
        assertThat(outcome.getSqlText()).contains("location = 'Sylhet'");
    }

    @Test
    void unloadedDatasetFails() {
        CsvDatasetTool unloaded = new CsvDatasetTool("hospitals", "data/test-institutions.csv", LEXICON,
                List.of("type"), "bed_capacity");

        assertThat(unloaded.run(Query.of("hospitals in Dhaka")).isSuccess()).isFalse();
    }

    @Test
    void missingOrMalformedFiles() {
        CsvDatasetTool missing = new CsvDatasetTool("x", "data/missing.csv", LEXICON, List.of(), null);
        assertThatThrownBy(missing::load).isInstanceOf(IllegalStateException.class);

        CsvDatasetTool broken = new CsvDatasetTool("x", "data/broken.csv", LEXICON, List.of("type"), null);
        broken.load();
        assertThat(broken.size()).isZero();
    }
}
