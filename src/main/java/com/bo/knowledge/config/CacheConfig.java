package com.bo.knowledge.config;

import com.bo.knowledge.service.CacheStore;
import com.bo.knowledge.service.JdbcCacheStore;
import com.bo.knowledge.service.ResultCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Cache configuration
 * Chooses the cache backend and starts and stops the expiry sweep
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * H2 table when persistence is on, memory only otherwise
     */
    @Bean
    public CacheStore cacheStore(@Value("${agent.cache.persistent:false}") boolean persistent,
                                 ObjectProvider<JdbcTemplate> jdbcTemplate) {
        if (!persistent) {
            return CacheStore.NONE;
        }
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (template == null) {
            log.warn("Persistent cache requested but no DataSource is configured, using memory only");
            return CacheStore.NONE;
        }
        JdbcCacheStore store = new JdbcCacheStore(template);
        store.initSchema();
        log.info("Persistent cache enabled - Rows: {}", store.count());
        return store;
    }

    @Bean
    public ApplicationRunner cacheInitializer(ResultCache resultCache,
                                              @Value("${agent.cache.sweep-interval-seconds:300}") long sweepIntervalSeconds) {
        return args -> {
            resultCache.init(sweepIntervalSeconds);

            Runtime.getRuntime().addShutdownHook(new Thread(resultCache::destroy));
        };
    }
}
