package com.bo.knowledge.config;

import com.bo.knowledge.model.QuestionType;

import static com.bo.knowledge.model.ToolNames.HOSPITALS;
import static com.bo.knowledge.model.ToolNames.INSTITUTIONS;
import static com.bo.knowledge.model.ToolNames.RESTAURANTS;
import static com.bo.knowledge.model.ToolNames.WEB_SEARCH;

/**
 * Built-in lexicon for the Bangladesh knowledge domains
 */
public final class DefaultLexicon {

    /**
     * Weight of a single keyword match
     */
    private static final double WORD_WEIGHT = 1.0;

    /**
     * Weight of a multi-word phrase match
     */
    private static final double PHRASE_WEIGHT = 1.5;

    /**
     * Weight of analysis and economic cues, these almost always need web search
     */
    private static final double ANALYSIS_WEIGHT = 3.0;

    private DefaultLexicon() {
    }

    public static Lexicon create() {
        Lexicon.Builder builder = Lexicon.builder();
        initInstitutions(builder);
        initHospitals(builder);
        initRestaurants(builder);
        initWebSearch(builder);
        initQuestionPatterns(builder);
        initGazetteer(builder);
        return builder
                .priority(INSTITUTIONS, HOSPITALS, RESTAURANTS, WEB_SEARCH)
                .fallbackTool(WEB_SEARCH)
                .positionalBonus(0.25)
                .build();
    }

    private static void initInstitutions(Lexicon.Builder builder) {
        builder.keywords(INSTITUTIONS, WORD_WEIGHT,
                "university", "universities", "college", "colleges", "institution", "institutions",
                "institute", "institutes", "education", "educational", "school", "schools",
                "academic", "student", "students", "faculty", "degree", "degrees", "campus");
        builder.keywords(INSTITUTIONS, PHRASE_WEIGHT,
                "university of", "college of", "institute of",
                "university in", "universities in", "college in", "colleges in",
                "institution in", "institutions in", "school in", "schools in");
    }

    private static void initHospitals(Lexicon.Builder builder) {
        builder.keywords(HOSPITALS, WORD_WEIGHT,
                "hospital", "hospitals", "medical", "healthcare", "clinic", "clinics",
                "doctor", "doctors", "nurse", "nurses", "patient", "patients",
                "bed", "beds", "emergency", "surgery");
        builder.keywords(HOSPITALS, PHRASE_WEIGHT,
                "medical college", "health center", "medical facility",
                "hospital in", "hospitals in", "clinic in", "clinics in");
    }

    private static void initRestaurants(Lexicon.Builder builder) {
        builder.keywords(RESTAURANTS, WORD_WEIGHT,
                "restaurant", "restaurants", "food", "dining", "eat", "meal", "meals",
                "cuisine", "menu", "dish", "dishes", "cooking", "chef", "rating", "ratings", "rated");
        builder.keywords(RESTAURANTS, PHRASE_WEIGHT,
                "restaurant in", "restaurants in", "food in", "eat in", "dining in", "cuisine in");
    }

    private static void initWebSearch(Lexicon.Builder builder) {
        builder.keywords(WEB_SEARCH, WORD_WEIGHT,
                "policy", "policies", "government", "history", "cultural", "culture",
                "festival", "festivals", "economy", "economic", "development", "statistics",
                "population", "weather", "news", "current", "definition", "overview", "background");
        builder.keywords(WEB_SEARCH, PHRASE_WEIGHT,
                "what is", "who is", "when was", "how to");
        builder.keywords(WEB_SEARCH, ANALYSIS_WEIGHT,
                "inflation", "impact", "compare", "analysis", "trend", "growth",
                "market", "finance", "investment", "cost", "price", "budget");
    }

    /**
     * Registration order is detection priority: count, list, comparison, filter
     */
    private static void initQuestionPatterns(Lexicon.Builder builder) {
        builder.questionPattern(QuestionType.COUNT,
                "how many", "number of", "count of", "total number", "how much", "quantity of");
        builder.questionPattern(QuestionType.LIST,
                "list", "list all", "show all", "find all", "get all", "display all", "enumerate");
        builder.questionPattern(QuestionType.COMPARISON,
                "compare", "comparison", "versus", "vs", "difference between", "better than",
                "best", "top", "highest", "lowest", "ranking");
        builder.questionPattern(QuestionType.FILTER,
                "with", "established after", "established before", "more than", "less than",
                "greater than", "fewer than", "at least", "at most", "after", "before",
                "where", "rated above");
    }

    private static void initGazetteer(Lexicon.Builder builder) {
        // divisions and major cities, datasets use the current spellings
        builder.places("Dhaka", "Rajshahi", "Khulna", "Sylhet", "Rangpur", "Mymensingh", "Bangladesh");
        builder.place("Chattogram", "Chittagong");
        builder.place("Barishal", "Barisal");
        builder.place("Cumilla", "Comilla");
        builder.place("Jashore", "Jessore");
        builder.places("Gazipur", "Narayanganj", "Bogura", "Cox's Bazar");
        // Dhaka neighbourhoods
        builder.within("Dhaka", "Old Dhaka", "Dhanmondi", "Gulshan", "Banani", "Uttara", "Mirpur", "Motijheel");
    }
}
