package com.bo.knowledge.tool;

import com.bo.knowledge.config.Lexicon;
import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;
import com.bo.knowledge.service.KeywordMatcher;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Domain tool over a CSV dataset
 * Loads the dataset from the classpath and answers lookups by location, category,
 * establishment year and one numeric column.
 *
 * Every dataset has name, location and established columns.
 */
@Slf4j
public class CsvDatasetTool implements ToolExecutor {

    private static final int MAX_LISTED = 10;

    private static final Pattern AFTER_YEAR = Pattern.compile("\\b(?:after|since)\\s+(\\d{4})\\b");
    private static final Pattern BEFORE_YEAR = Pattern.compile("\\bbefore\\s+(\\d{4})\\b");
    /**
     * Thresholds may carry thousands separators ("1,000")
     */
    private static final Pattern MORE_THAN = Pattern.compile(
            "\\b(?:more than|greater than|over|above|at least)\\s+(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)");
    private static final Pattern LESS_THAN = Pattern.compile(
            "\\b(?:less than|fewer than|under|below|at most)\\s+(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)");

    /**
     * Every row is in the country, naming it does not filter
     */
    private static final String COUNTRY = "bangladesh";

    private static final List<String> COUNT_PHRASES = List.of("how many", "number of", "count of", "total number");

    private final String name;
    private final String resourcePath;

    private final Lexicon lexicon;

    private final List<String> categoryColumns;
    private final String numericColumn;

    /**
     * Rows keyed by header name
     */
    private List<Map<String, String>> rows = new ArrayList<>();

    /**
     * @param name            tool name, also used as the table name in the reported query
     * @param resourcePath    classpath location of the CSV file
     * @param lexicon         supplies the place gazetteer
     * @param categoryColumns columns whose values can be named in a query ("university", "chinese")
     * @param numericColumn   column compared by "more than N" / "less than N"
     */
    public CsvDatasetTool(String name, String resourcePath, Lexicon lexicon,
                          List<String> categoryColumns, String numericColumn) {
        this.name = name;
        this.resourcePath = resourcePath;
        this.lexicon = lexicon;
        this.categoryColumns = List.copyOf(categoryColumns);
        this.numericColumn = numericColumn;
    }

    /**
     * Load the dataset
     *
     * @throws IllegalStateException if the file is missing or unreadable
     */
    public void load() {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new IllegalStateException("Dataset not found on classpath: " + resourcePath);
        }

        List<String[]> allRows;
        try (CSVReader reader = new CSVReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            allRows = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new IllegalStateException("Failed to read dataset " + resourcePath, e);
        }
        if (allRows.isEmpty()) {
            throw new IllegalStateException("Dataset has no header: " + resourcePath);
        }

        String[] header = allRows.get(0);
        List<Map<String, String>> loaded = new ArrayList<>();
        // skip the header
        for (int i = 1; i < allRows.size(); i++) {
            String[] row = allRows.get(i);
            if (row.length < header.length) {
                log.warn("Skipping short row {} in {}", i + 1, resourcePath);
                continue;
            }
            Map<String, String> record = new LinkedHashMap<>();
            for (int c = 0; c < header.length; c++) {
                record.put(header[c].trim(), row[c].trim());
            }
            loaded.add(Collections.unmodifiableMap(record));
        }
        this.rows = Collections.unmodifiableList(loaded);
        log.info("Dataset loaded - Tool: {}, Rows: {}", name, rows.size());
    }

    @Override
    public String name() {
        return name;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public ExecutionOutcome run(Query query) {
        if (rows.isEmpty()) {
            return ExecutionOutcome.failure("The " + name + " dataset is not available.");
        }
        String text = query.getNormalized();
        String lower = query.getOriginal().toLowerCase(Locale.ROOT);

        List<String> conditions = new ArrayList<>();
        List<Predicate<Map<String, String>>> filters = new ArrayList<>();

        // 1. location, a named place with no rows yields an empty result
        String place = detectPlace(text);
        if (place != null) {
            String displayName = lexicon.gazetteer().get(place);
            String area = Query.normalize(displayName);
            filters.add(row -> lexicon.isWithin(Query.normalize(row.get("location")), area));
            conditions.add("location = '" + displayName + "'");
        }

        // 2. categories
        for (String column : categoryColumns) {
            Set<String> values = matchValues(column, text);
            if (!values.isEmpty()) {
                filters.add(row -> values.contains(row.getOrDefault(column, "").toLowerCase(Locale.ROOT)));
                conditions.add(inCondition(column, values));
            }
        }

        // 3. establishment year
        Matcher after = AFTER_YEAR.matcher(lower);
        if (after.find()) {
            int year = Integer.parseInt(after.group(1));
            filters.add(row -> parse(row.get("established")) > year);
            conditions.add("established > " + year);
        }
        Matcher before = BEFORE_YEAR.matcher(lower);
        if (before.find()) {
            int year = Integer.parseInt(before.group(1));
            filters.add(row -> parse(row.get("established")) < year);
            conditions.add("established < " + year);
        }

        // 4. numeric column, years are handled above
        if (numericColumn != null) {
            Matcher more = MORE_THAN.matcher(lower);
            if (more.find() && !isYearClause(lower, more.start())) {
                String bound = more.group(1).replace(",", "");
                double value = Double.parseDouble(bound);
                filters.add(row -> parse(row.get(numericColumn)) > value);
                conditions.add(numericColumn + " > " + bound);
            }
            Matcher less = LESS_THAN.matcher(lower);
            if (less.find() && !isYearClause(lower, less.start())) {
                String bound = less.group(1).replace(",", "");
                double value = Double.parseDouble(bound);
                filters.add(row -> parse(row.get(numericColumn)) < value);
                conditions.add(numericColumn + " < " + bound);
            }
        }

        Predicate<Map<String, String>> all = filters.stream().reduce(row -> true, Predicate::and);
        List<Map<String, String>> matched = rows.stream().filter(all).collect(Collectors.toList());

        boolean countQuestion = COUNT_PHRASES.stream().anyMatch(p -> KeywordMatcher.contains(text, p));
        String sql = (countQuestion ? "SELECT COUNT(*) FROM " : "SELECT * FROM ") + name
                + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions));

        log.debug("Dataset query - Tool: {}, SQL: {}, Matched: {}", name, sql, matched.size());

        if (matched.isEmpty()) {
            return ExecutionOutcome.empty("No " + name + " found matching your query.", sql);
        }
        if (countQuestion) {
            String counted = matched.size() == 1 ? "Found 1 result matching your criteria."
                    : String.format("Found %d %s matching your criteria.", matched.size(), name);
            return ExecutionOutcome.success(counted, sql);
        }
        return ExecutionOutcome.success(formatRows(matched), sql);
    }

    /**
     * Longest gazetteer place in the text, normalized; earliest wins among equal lengths
     */
    private String detectPlace(String text) {
        String best = null;
        int bestOffset = Integer.MAX_VALUE;
        for (String candidate : lexicon.gazetteer().keySet()) {
            int offset = KeywordMatcher.indexOf(text, candidate);
            if (offset < 0 || COUNTRY.equals(candidate)) {
                continue;
            }
            if (best == null || candidate.length() > best.length()
                    || (candidate.length() == best.length() && offset < bestOffset)) {
                best = candidate;
                bestOffset = offset;
            }
        }
        return best;
    }

    /**
     * Distinct column values named in the query, lowercased; plural forms count
     */
    private Set<String> matchValues(String column, String text) {
        Set<String> found = new LinkedHashSet<>();
        for (Map<String, String> row : rows) {
            String value = row.get(column);
            if (value == null || value.isEmpty()) {
                continue;
            }
            String normalized = Query.normalize(value);
            if (KeywordMatcher.contains(text, normalized)
                    || KeywordMatcher.contains(text, pluralOf(normalized))) {
                found.add(value.toLowerCase(Locale.ROOT));
            }
        }
        // "general hospital" names General Hospital, not General as well
        List<String> matched = new ArrayList<>(found);
        found.removeIf(value -> matched.stream().anyMatch(other -> !other.equals(value)
                && KeywordMatcher.contains(Query.normalize(other), Query.normalize(value))));
        return found;
    }

    private String formatRows(List<Map<String, String>> matched) {
        StringBuilder sb = new StringBuilder();
        if (matched.size() == 1) {
            sb.append("Found 1 result:\n");
        } else {
            sb.append(String.format("Found %d %s:\n", matched.size(), name));
        }
        int index = 1;
        for (Map<String, String> row : matched.subList(0, Math.min(MAX_LISTED, matched.size()))) {
            sb.append(index++).append(". ").append(row.get("name"));
            if (!categoryColumns.isEmpty()) {
                sb.append(" - ").append(row.getOrDefault(categoryColumns.get(0), "Unknown"));
            }
            sb.append(" in ").append(row.get("location"));
            String established = row.get("established");
            if (established != null && !established.isEmpty()) {
                sb.append(" (Est. ").append(established).append(")");
            }
            if (numericColumn != null && row.get(numericColumn) != null) {
                sb.append(", ").append(numericColumn.replace('_', ' ')).append(": ").append(row.get(numericColumn));
            }
            sb.append("\n");
        }
        if (matched.size() > MAX_LISTED) {
            sb.append("... and ").append(matched.size() - MAX_LISTED).append(" more.");
        }
        return sb.toString().trim();
    }

    private static String inCondition(String column, Set<String> values) {
        return column + " IN (" + values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ")) + ")";
    }

    private static String pluralOf(String word) {
        if (word.endsWith("y")) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        return word + "s";
    }

    /**
     * "more than 1950" right after "established" is a year clause, not a numeric one
     */
    private static boolean isYearClause(String text, int matchStart) {
        return text.substring(0, matchStart).trim().endsWith("established");
    }

    private static double parse(String value) {
        if (value == null || value.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
