package com.bo.knowledge.model;

import lombok.Data;

import java.util.List;

/**
 * Cache statistics
 */
@Data
public final class CacheStats {

    private final int totalEntries;
    private final int liveEntries;
    private final double averageHitCount;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final int maxEntries;
    private final long defaultTtlSeconds;

    /**
     * Most hit entries, at most five
     */
    private final List<PopularEntry> popularEntries;

    public int getExpiredEntries() {
        return totalEntries - liveEntries;
    }

    public double getHitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }

    @Data
    public static final class PopularEntry {
        private final String query;
        private final String toolName;
        private final long hitCount;
    }
}
