package com.bo.knowledge.service;

import com.bo.knowledge.model.CacheEntry;

import java.time.Instant;

/**
 * Durable backing store for {@link ResultCache}
 * Implementations may throw runtime exceptions; the cache treats any failure as a miss.
 */
public interface CacheStore {

    /**
     * Store that keeps nothing, the cache then lives in memory only
     */
    CacheStore NONE = new CacheStore() {
        @Override
        public CacheEntry load(String key) {
            return null;
        }

        @Override
        public void save(CacheEntry entry) {
        }

        @Override
        public void delete(String key) {
        }

        @Override
        public int deleteExpired(Instant now) {
            return 0;
        }

        @Override
        public void clear() {
        }
    };

    /**
     * @return the stored row, or null when absent
     */
    CacheEntry load(String key);

    /**
     * Insert or replace the row for the entry's key
     */
    void save(CacheEntry entry);

    void delete(String key);

    int deleteExpired(Instant now);

    void clear();
}
