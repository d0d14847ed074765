package com.defai.backend.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry time-to-live. Values are serialized JSON text.
 */
public interface CacheStore {

    Optional<String> get(String key);

    /**
     * Stores the value, replacing any previous value and its TTL.
     */
    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * Deletes every key matching a glob pattern ({@code *}, {@code ?}). Returns the count removed.
     */
    int deletePattern(String pattern);

    CacheStats stats();
}
