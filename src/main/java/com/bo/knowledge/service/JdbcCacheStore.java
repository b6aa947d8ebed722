package com.bo.knowledge.service;

import com.bo.knowledge.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;

/**
 * Cache store backed by a JDBC table
 * Rows survive restarts, so a warm cache is available right after startup.
 */
@Slf4j
public class JdbcCacheStore implements CacheStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCacheStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Create the cache table if it does not exist yet
     */
    public void initSchema() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS query_cache (
                    cache_key     VARCHAR(2048) PRIMARY KEY,
                    query_text    VARCHAR(2048) NOT NULL,
                    tool_name     VARCHAR(64)   NOT NULL,
                    cache_value   CLOB          NOT NULL,
                    created_at    TIMESTAMP     NOT NULL,
                    ttl_seconds   BIGINT        NOT NULL,
                    hit_count     BIGINT        NOT NULL,
                    last_accessed TIMESTAMP     NOT NULL
                )
                """);
        log.info("Cache table ready");
    }

    @Override
    public CacheEntry load(String key) {
        try {
            return jdbcTemplate.queryForObject("""
                    SELECT cache_key, query_text, tool_name, cache_value, created_at,
                           ttl_seconds, hit_count, last_accessed
                    FROM query_cache WHERE cache_key = ?
                    """,
                    (rs, rowNum) -> new CacheEntry(
                            rs.getString("cache_key"),
                            rs.getString("query_text"),
                            rs.getString("tool_name"),
                            rs.getString("cache_value"),
                            rs.getTimestamp("created_at").toInstant(),
                            rs.getLong("ttl_seconds"),
                            rs.getLong("hit_count"),
                            rs.getTimestamp("last_accessed").toInstant()),
                    key);
        } catch (EmptyResultDataAccessException e) {
            return null;
        }
    }

    @Override
    public void save(CacheEntry entry) {
        jdbcTemplate.update("""
                MERGE INTO query_cache (cache_key, query_text, tool_name, cache_value, created_at,
                                        ttl_seconds, hit_count, last_accessed)
                KEY (cache_key)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                entry.getKey(),
                entry.getQuery(),
                entry.getToolName(),
                entry.getValue(),
                Timestamp.from(entry.getCreatedAt()),
                entry.getTtlSeconds(),
                entry.getHitCount(),
                Timestamp.from(entry.getLastAccessed()));
    }

    @Override
    public void delete(String key) {
        jdbcTemplate.update("DELETE FROM query_cache WHERE cache_key = ?", key);
    }

    @Override
    public int deleteExpired(Instant now) {
        // expiry computed in Java, rows only store created_at and ttl
        return jdbcTemplate.query("SELECT cache_key, created_at, ttl_seconds FROM query_cache",
                        (rs, rowNum) -> {
                            Instant expiresAt = rs.getTimestamp("created_at").toInstant()
                                    .plusSeconds(rs.getLong("ttl_seconds"));
                            return now.isBefore(expiresAt) ? null : rs.getString("cache_key");
                        })
                .stream()
                .filter(Objects::nonNull)
                .mapToInt(key -> jdbcTemplate.update("DELETE FROM query_cache WHERE cache_key = ?", key))
                .sum();
    }

    @Override
    public void clear() {
        jdbcTemplate.update("DELETE FROM query_cache");
    }

    public int count() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM query_cache", Integer.class);
        return count == null ? 0 : count;
    }
}
