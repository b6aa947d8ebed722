package com.bo.knowledge.service;

import com.bo.knowledge.model.CacheEntry;
import com.bo.knowledge.model.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Result cache
 * Tool results keyed by (normalized query, tool name), bounded by an entry count
 * with least-recently-used eviction and expired by TTL.
 *
 * All operations run under one lock: hit counters and recency order are
 * read-modify-write state. The map is kept in recency order, oldest first;
 * a hit moves the entry to the tail, a write does not.
 */
@Slf4j
@Service
public class ResultCache {

    /**
     * Normalized queries only hold letters, digits and spaces, so this never collides
     */
    private static final String KEY_SEPARATOR = "|";

    private static final int POPULAR_LIMIT = 5;

    private final int maxEntries;
    private final long defaultTtlSeconds;
    private final Clock clock;
    private final CacheStore store;

    private final Object lock = new Object();

    /**
     * Entries in recency order, least recently used first
     */
    private final LinkedHashMap<String, Slot> entries = new LinkedHashMap<>();

    /**
     * Statistics since startup or the last clear
     */
    private long hitCount;
    private long missCount;
    private long evictionCount;

    /**
     * Periodic sweep of expired entries
     */
    private ScheduledExecutorService cleanupExecutor;

    public ResultCache(@Value("${agent.cache.max-entries:1000}") int maxEntries,
                       @Value("${agent.cache.ttl-seconds:3600}") long defaultTtlSeconds,
                       Clock clock,
                       CacheStore store) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be positive: " + defaultTtlSeconds);
        }
        this.maxEntries = maxEntries;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.clock = clock;
        this.store = store == null ? CacheStore.NONE : store;
    }

    /**
     * Mutable cache entry, never handed out
     */
    private static final class Slot {
        private final String key;
        private final String query;
        private final String toolName;
        private String value;
        private Instant createdAt;
        private long ttlSeconds;
        private long hitCount;
        private Instant lastAccessed;

        private Slot(String key, String query, String toolName, String value,
                     Instant createdAt, long ttlSeconds, long hitCount, Instant lastAccessed) {
            this.key = key;
            this.query = query;
            this.toolName = toolName;
            this.value = value;
            this.createdAt = createdAt;
            this.ttlSeconds = ttlSeconds;
            this.hitCount = hitCount;
            this.lastAccessed = lastAccessed;
        }

        private static Slot of(CacheEntry entry) {
            return new Slot(entry.getKey(), entry.getQuery(), entry.getToolName(), entry.getValue(),
                    entry.getCreatedAt(), entry.getTtlSeconds(), entry.getHitCount(), entry.getLastAccessed());
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(createdAt.plusSeconds(ttlSeconds));
        }

        private CacheEntry snapshot() {
            return new CacheEntry(key, query, toolName, value, createdAt, ttlSeconds, hitCount, lastAccessed);
        }
    }

    public static String keyOf(String normalizedQuery, String toolName) {
        return (normalizedQuery == null ? "" : normalizedQuery) + KEY_SEPARATOR + toolName;
    }

    /**
     * Start the periodic sweep of expired entries
     */
    public void init(long sweepIntervalSeconds) {
        if (sweepIntervalSeconds <= 0) {
            log.info("Result cache ready - Max entries: {}, Default TTL: {}s, Sweep: disabled",
                    maxEntries, defaultTtlSeconds);
            return;
        }
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredEntries,
                sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);

        log.info("Result cache ready - Max entries: {}, Default TTL: {}s, Sweep every: {}s",
                maxEntries, defaultTtlSeconds, sweepIntervalSeconds);
    }

    /**
     * Stop the sweep
     */
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdown();
        }
        log.info("Result cache stopped");
    }

    /**
     * Look up a cached result
     * A hit bumps the hit count and recency; an expired entry is removed and counts as a miss.
     *
     * @return a snapshot of the entry, or null on a miss
     */
    public CacheEntry get(String normalizedQuery, String toolName) {
        String key = keyOf(normalizedQuery, toolName);
        synchronized (lock) {
            Instant now = clock.instant();
            Slot slot = entries.get(key);
            if (slot == null) {
                slot = loadFromStore(key, now);
            }

            if (slot != null && slot.isExpired(now)) {
                entries.remove(key);
                deleteFromStore(key);
                log.debug("Cache entry expired - Key: {}", key);
                slot = null;
            }

            if (slot == null) {
                missCount++;
                log.debug("Cache miss - Key: {}", key);
                return null;
            }

            slot.hitCount++;
            slot.lastAccessed = now;
            // move to the most recently used end
            entries.remove(key);
            entries.put(key, slot);
            hitCount++;
            saveToStore(slot);

            log.debug("Cache hit - Key: {}, Hits: {}", key, slot.hitCount);
            return slot.snapshot();
        }
    }

    public void set(String normalizedQuery, String toolName, String value) {
        set(normalizedQuery, toolName, value, defaultTtlSeconds);
    }

    /**
     * Insert or replace a cached result
     * Replacing resets the creation time but leaves recency untouched: a write is not an access.
     */
    public void set(String normalizedQuery, String toolName, String value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive: " + ttlSeconds);
        }
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        String key = keyOf(normalizedQuery, toolName);
        synchronized (lock) {
            Instant now = clock.instant();
            Slot slot = entries.get(key);
            if (slot != null) {
                slot.value = value;
                slot.createdAt = now;
                slot.ttlSeconds = ttlSeconds;
            } else {
                while (entries.size() >= maxEntries) {
                    evictEldest();
                }
                slot = new Slot(key, normalizedQuery, toolName, value, now, ttlSeconds, 0, now);
                entries.put(key, slot);
            }
            saveToStore(slot);
            log.debug("Result cached - Key: {}, TTL: {}s, Size: {}", key, ttlSeconds, entries.size());
        }
    }

    /**
     * Remove one entry
     *
     * @return true if the entry was cached
     */
    public boolean invalidate(String normalizedQuery, String toolName) {
        String key = keyOf(normalizedQuery, toolName);
        synchronized (lock) {
            boolean removed = entries.remove(key) != null;
            deleteFromStore(key);
            log.debug("Cache entry invalidated - Key: {}, Existed: {}", key, removed);
            return removed;
        }
    }

    /**
     * Remove every entry whose TTL has elapsed
     *
     * @return number of entries removed
     */
    public int invalidateExpired() {
        synchronized (lock) {
            Instant now = clock.instant();
            int removed = 0;
            Iterator<Map.Entry<String, Slot>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            try {
                store.deleteExpired(now);
            } catch (RuntimeException e) {
                log.warn("Cache store sweep failed: {}", e.getMessage());
            }
            if (removed > 0) {
                log.debug("Expired cache entries removed: {}", removed);
            }
            return removed;
        }
    }

    /**
     * Remove every entry and reset statistics
     *
     * @return number of entries removed
     */
    public int clearAll() {
        synchronized (lock) {
            int removed = entries.size();
            entries.clear();
            hitCount = 0;
            missCount = 0;
            evictionCount = 0;
            try {
                store.clear();
            } catch (RuntimeException e) {
                log.warn("Cache store clear failed: {}", e.getMessage());
            }
            log.info("Result cache cleared - Removed: {}", removed);
            return removed;
        }
    }

    public CacheStats statistics() {
        synchronized (lock) {
            Instant now = clock.instant();
            int live = 0;
            long totalHits = 0;
            for (Slot slot : entries.values()) {
                if (!slot.isExpired(now)) {
                    live++;
                }
                totalHits += slot.hitCount;
            }
            double averageHits = entries.isEmpty() ? 0.0 : (double) totalHits / entries.size();

            List<CacheStats.PopularEntry> popular = entries.values().stream()
                    .sorted(Comparator.comparingLong((Slot s) -> s.hitCount).reversed())
                    .limit(POPULAR_LIMIT)
                    .map(s -> new CacheStats.PopularEntry(s.query, s.toolName, s.hitCount))
                    .collect(Collectors.toList());

            return new CacheStats(entries.size(), live, averageHits, hitCount, missCount, evictionCount,
                    maxEntries, defaultTtlSeconds, popular);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /**
     * Keys in recency order, least recently used first
     */
    List<String> keysInRecencyOrder() {
        synchronized (lock) {
            return new ArrayList<>(entries.keySet());
        }
    }

    // caller holds the lock
    private void evictEldest() {
        Iterator<Map.Entry<String, Slot>> it = entries.entrySet().iterator();
        if (!it.hasNext()) {
            return;
        }
        String key = it.next().getKey();
        it.remove();
        evictionCount++;
        deleteFromStore(key);
        log.debug("LRU eviction - Key: {}", key);
    }

    // caller holds the lock
    private Slot loadFromStore(String key, Instant now) {
        CacheEntry row;
        try {
            row = store.load(key);
        } catch (RuntimeException e) {
            log.warn("Cache store read failed, treating as miss - Key: {}, Error: {}", key, e.getMessage());
            return null;
        }
        if (row == null) {
            return null;
        }
        Slot slot = Slot.of(row);
        if (slot.isExpired(now)) {
            return slot;
        }
        while (entries.size() >= maxEntries) {
            evictEldest();
        }
        entries.put(key, slot);
        log.debug("Cache entry restored from store - Key: {}", key);
        return slot;
    }

    private void saveToStore(Slot slot) {
        try {
            store.save(slot.snapshot());
        } catch (RuntimeException e) {
            log.warn("Cache store write failed, entry kept in memory only - Key: {}, Error: {}",
                    slot.key, e.getMessage());
        }
    }

    private void deleteFromStore(String key) {
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.warn("Cache store delete failed - Key: {}, Error: {}", key, e.getMessage());
        }
    }

    private void cleanupExpiredEntries() {
        try {
            int removed = invalidateExpired();
            if (removed > 0) {
                log.debug("Cache sweep - Removed: {}", removed);
            }
        } catch (Exception e) {
            log.error("Cache sweep failed", e);
        }
    }
}
