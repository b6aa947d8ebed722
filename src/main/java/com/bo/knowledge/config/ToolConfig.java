package com.bo.knowledge.config;

import com.bo.knowledge.model.ToolNames;
import com.bo.knowledge.tool.CsvDatasetTool;
import com.bo.knowledge.tool.FallbackToolExecutor;
import com.bo.knowledge.tool.ToolExecutor;
import com.bo.knowledge.tool.ToolRegistry;
import com.bo.knowledge.tool.WebSearchTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Tool wiring
 * One CSV-backed tool per domain plus web search; domain tools fall back to web search when enabled.
 */
@Slf4j
@Configuration
public class ToolConfig {

    @Value("${agent.tools.fallback-enabled:true}")
    private boolean fallbackEnabled;

    @Value("${agent.tools.datasets.institutions:data/institutions.csv}")
    private String institutionsPath;

    @Value("${agent.tools.datasets.hospitals:data/hospitals.csv}")
    private String hospitalsPath;

    @Value("${agent.tools.datasets.restaurants:data/restaurants.csv}")
    private String restaurantsPath;

    @Bean
    public WebSearchTool webSearchTool(@Value("${agent.tools.web-search.api-key:}") String apiKey,
                                       @Value("${agent.tools.web-search.url:https://api.tavily.com/search}") String apiUrl,
                                       @Value("${agent.tools.web-search.max-results:3}") int maxResults) {
        return new WebSearchTool(apiKey, apiUrl, maxResults);
    }

    @Bean
    public ToolRegistry toolRegistry(WebSearchTool webSearchTool, Lexicon lexicon) {
        List<CsvDatasetTool> datasets = List.of(
                new CsvDatasetTool(ToolNames.INSTITUTIONS, institutionsPath, lexicon,
                        List.of("type", "public_private"), "students_count"),
                new CsvDatasetTool(ToolNames.HOSPITALS, hospitalsPath, lexicon,
                        List.of("type", "public_private"), "bed_capacity"),
                new CsvDatasetTool(ToolNames.RESTAURANTS, restaurantsPath, lexicon,
                        List.of("cuisine", "price_range"), "rating"));

        List<ToolExecutor> executors = new ArrayList<>();
        for (CsvDatasetTool dataset : datasets) {
            dataset.load();
            executors.add(fallbackEnabled ? new FallbackToolExecutor(dataset, webSearchTool) : dataset);
        }
        executors.add(webSearchTool);
        return new ToolRegistry(executors);
    }
}
