package com.bo.knowledge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Agent configuration
 * Provides the routing lexicon and logs the effective settings at startup
 */
@Slf4j
@Configuration
public class AgentConfig {

    @Value("${agent.tools.web-search.api-key:}")
    private String webSearchApiKey;

    @Value("${agent.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${agent.cache.persistent:false}")
    private boolean cachePersistent;

    @Value("${agent.tools.fallback-enabled:true}")
    private boolean fallbackEnabled;

    @Value("${agent.router.tool-timeout-seconds:30}")
    private long toolTimeoutSeconds;

    @Bean
    public Lexicon lexicon() {
        return DefaultLexicon.create();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateConfiguration() {
        log.info("========== Agent configuration ==========");

        if (webSearchApiKey == null || webSearchApiKey.trim().isEmpty()) {
            log.warn("Web search API key not configured, web search answers known topics offline only");
            log.warn("   Set agent.tools.web-search.api-key in application.yml");
        } else {
            log.info("Web search API key configured (length: {})", webSearchApiKey.length());
        }

        log.info("Result cache: {}, persistent: {}", cacheEnabled ? "on" : "off", cachePersistent);
        log.info("Web search fallback: {}", fallbackEnabled ? "on" : "off");
        log.info("Tool timeout: {}s", toolTimeoutSeconds);

        log.info("=========================================");
    }
}
