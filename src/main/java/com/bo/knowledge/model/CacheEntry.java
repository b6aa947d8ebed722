package com.bo.knowledge.model;

import lombok.Data;

import java.time.Instant;

/**
 * Snapshot of a cached result
 * The cache hands out copies, its own entries never leave it
 */
@Data
public final class CacheEntry {

    private final String key;
    private final String query;
    private final String toolName;
    private final String value;
    private final Instant createdAt;
    private final long ttlSeconds;
    private final long hitCount;
    private final Instant lastAccessed;
}
