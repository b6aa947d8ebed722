package com.bo.knowledge.tool;

import com.bo.knowledge.model.ExecutionOutcome;
import com.bo.knowledge.model.Query;
import com.bo.knowledge.model.ToolNames;
import com.bo.knowledge.service.KeywordMatcher;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web search tool
 * Calls the Tavily search API. Without an API key it answers a small set of
 * known topics offline and fails everything else.
 */
@Slf4j
public class WebSearchTool implements ToolExecutor {

    private static final int SNIPPET_LENGTH = 300;

    private final String apiKey;
    private final String apiUrl;
    private final int maxResults;

    private final HttpClient httpClient;
    private final Gson gson;

    /**
     * Offline topics, keyed by the words that must all appear in the query
     */
    private final Map<String, String> offlineTopics = new LinkedHashMap<>();

    public WebSearchTool(String apiKey, String apiUrl, int maxResults) {
        this(apiKey, apiUrl, maxResults, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    WebSearchTool(String apiKey, String apiUrl, int maxResults, HttpClient httpClient) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.maxResults = maxResults;
        this.httpClient = httpClient;
        this.gson = new Gson();
        initOfflineTopics();
    }

    @Override
    public String name() {
        return ToolNames.WEB_SEARCH;
    }

    public boolean isOnline() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ExecutionOutcome run(Query query) {
        if (!isOnline()) {
            return searchOffline(query);
        }
        try {
            return searchOnline(query);
        } catch (IOException | JsonParseException e) {
            log.error("Web search failed - Query: '{}'", query.getOriginal(), e);
            return ExecutionOutcome.failure("Web search failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failure("Web search interrupted");
        }
    }

    private ExecutionOutcome searchOnline(Query query) throws IOException, InterruptedException {
        SearchRequest body = new SearchRequest(apiKey, query.getOriginal(), maxResults);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(20))
                .POST(HttpRequest.BodyPublishers.ofString(gson.toJson(body)))
                .build();

        long startTime = System.currentTimeMillis();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        log.debug("Web search response - Status: {}, Time: {}ms",
                response.statusCode(), System.currentTimeMillis() - startTime);

        if (response.statusCode() != 200) {
            log.warn("Web search returned status {} - Query: '{}'", response.statusCode(), query.getOriginal());
            return ExecutionOutcome.failure("Web search returned status " + response.statusCode());
        }

        SearchResponse parsed = gson.fromJson(response.body(), SearchResponse.class);
        if (parsed == null || parsed.getResults() == null || parsed.getResults().isEmpty()) {
            return ExecutionOutcome.empty("No search results found for '" + query.getOriginal() + "'.", null);
        }

        StringBuilder sb = new StringBuilder("Web search results for '").append(query.getOriginal()).append("':\n\n");
        int index = 1;
        for (SearchResult result : parsed.getResults().subList(0, Math.min(maxResults, parsed.getResults().size()))) {
            sb.append(index++).append(". ").append(result.getTitle() == null ? "No title" : result.getTitle()).append("\n");
            String content = result.getContent() == null ? "" : result.getContent();
            if (content.length() > SNIPPET_LENGTH) {
                content = content.substring(0, SNIPPET_LENGTH) + "...";
            }
            sb.append("   ").append(content).append("\n");
            if (result.getUrl() != null && !result.getUrl().isEmpty()) {
                sb.append("   Source: ").append(result.getUrl()).append("\n");
            }
        }
        return ExecutionOutcome.success(sb.toString().trim(), null);
    }

    private ExecutionOutcome searchOffline(Query query) {
        String text = query.getNormalized();
        for (Map.Entry<String, String> topic : offlineTopics.entrySet()) {
            boolean allPresent = Arrays.stream(topic.getKey().split(" "))
                    .allMatch(word -> KeywordMatcher.contains(text, word));
            if (allPresent) {
                log.debug("Offline web answer - Topic: {}", topic.getKey());
                return ExecutionOutcome.success(
                        "Web search results for '" + query.getOriginal() + "':\n\n" + topic.getValue(), null);
            }
        }
        return ExecutionOutcome.failure("Web search is not configured and no offline answer is available");
    }

    private void initOfflineTopics() {
        offlineTopics.put("healthcare policy", String.join("\n",
                "Bangladesh Healthcare Policy Overview:",
                "- The National Health Policy aims at universal health coverage",
                "- The Directorate General of Health Services (DGHS) implements it",
                "- Focus on primary healthcare and rural health services",
                "- Public-private partnership model for service delivery"));
        offlineTopics.put("dghs", String.join("\n",
                "Directorate General of Health Services (DGHS):",
                "- Main government body for healthcare administration in Bangladesh",
                "- Manages public hospitals and disease control programs",
                "- Reports to the Ministry of Health and Family Welfare"));
        offlineTopics.put("education system", String.join("\n",
                "Bangladesh Education System Structure:",
                "- Primary: classes 1-5",
                "- Junior secondary: classes 6-8",
                "- Secondary: classes 9-10",
                "- Higher secondary: classes 11-12",
                "- Tertiary: universities and colleges under the Ministry of Education"));
        offlineTopics.put("festivals", String.join("\n",
                "Major Cultural Festivals in Bangladesh:",
                "- Pohela Boishakh (Bengali New Year), April 14",
                "- Ekushey February (Language Martyrs Day), February 21",
                "- Independence Day, March 26",
                "- Victory Day, December 16",
                "- Eid-ul-Fitr, Eid-ul-Azha and Durga Puja"));
        offlineTopics.put("culture", String.join("\n",
                "Culture of Bangladesh:",
                "- Bengali language and literature, with Rabindranath Tagore and Kazi Nazrul Islam",
                "- Folk music traditions such as Baul and Bhatiali",
                "- Crafts including Nakshi Kantha and Jamdani weaving"));
        offlineTopics.put("economic", String.join("\n",
                "Bangladesh Economic Policies Overview:",
                "- Export-oriented industrial policy led by ready-made garments",
                "- Vision 2041 development plan",
                "- Special Economic Zones and foreign direct investment promotion",
                "- Microfinance and inclusive banking"));
        offlineTopics.put("inflation", String.join("\n",
                "Inflation in Bangladesh:",
                "- Bangladesh Bank sets monetary policy to contain inflation",
                "- Food prices and imported energy costs are the main drivers",
                "- Higher inflation erodes real incomes and raises borrowing costs"));
        offlineTopics.put("dhaka university", String.join("\n",
                "University of Dhaka - Historical Overview:",
                "- Established in 1921, the first university in present-day Bangladesh",
                "- Known as the \"Oxford of the East\"",
                "- Central to the Language Movement and the Independence Movement"));
    }

    // ========== Wire format ==========

    @Data
    static class SearchRequest {
        private final String api_key;
        private final String query;
        private final int max_results;
    }

    @Data
    static class SearchResponse {
        private List<SearchResult> results;
    }

    @Data
    static class SearchResult {
        private String title;
        private String url;
        private String content;
    }
}
