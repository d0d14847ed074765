package com.defai.backend.service.cache;

import com.defai.backend.config.OracleProperties;
import com.defai.backend.service.EngineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Engine-facing cache: owns the key layout, JSON (de)serialization and invalidation rules.
 * Store failures are logged and behave as a miss or a no-op. The last value written under each
 * key is also kept so a degraded recompute can fall back to it after the entry expires.
 */
@Slf4j
@Service
public class SentimentCache {

    public static final String ALL_SENTIMENTS_KEY = "sentiment:all";

    private final CacheStore store;
    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;
    private final Duration defaultTtl;
    private final Duration historyTtl;
    private final Map<String, String> lastWritten = new ConcurrentHashMap<>();

    public SentimentCache(CacheStore store, ObjectMapper objectMapper, EngineMetrics metrics, OracleProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.defaultTtl = Duration.ofSeconds(properties.getCache().getDefaultTtlSeconds());
        this.historyTtl = Duration.ofSeconds(properties.getCache().getHistoryTtlSeconds());
    }

    public static String sentimentKey(String token) {
        return "sentiment:" + normalize(token);
    }

    public static String historyKey(String token, int hours) {
        return "history:" + normalize(token) + ":" + hours + "h";
    }

    public static String snipeKey(String token) {
        return "snipe:" + normalize(token);
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public Duration historyTtl() {
        return historyTtl;
    }

    public <T> Optional<T> get(String key, JavaType type) {
        Optional<String> raw;
        try {
            raw = store.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for {}: {}", key, e.toString());
            metrics.recordCacheError();
            metrics.recordCacheMiss();
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            metrics.recordCacheMiss();
            return Optional.empty();
        }
        Optional<T> value = decode(key, raw.get(), type);
        if (value.isPresent()) {
            metrics.recordCacheHit();
        } else {
            metrics.recordCacheMiss();
        }
        return value;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, objectMapper.constructType(type));
    }

    /**
     * Last value written under the key, whether or not it is still live in the store.
     */
    public <T> Optional<T> lastKnown(String key, JavaType type) {
        String raw = lastWritten.get(key);
        return raw == null ? Optional.empty() : decode(key, raw, type);
    }

    public void put(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Cache serialization failed for {}: {}", key, e.getOriginalMessage());
            metrics.recordCacheError();
            return;
        }
        lastWritten.put(key, json);
        try {
            store.set(key, json, ttl);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}: {}", key, e.toString());
            metrics.recordCacheError();
        }
    }

    public void invalidateToken(String token) {
        String symbol = normalize(token);
        delete(sentimentKey(symbol));
        delete(snipeKey(symbol));
        delete(ALL_SENTIMENTS_KEY);
        int history = deletePattern("history:" + symbol + ":*");
        log.info("Invalidated cache for {} ({} history entries)", symbol, history);
    }

    public void evictHistory(String token) {
        deletePattern("history:" + normalize(token) + ":*");
    }

    public void invalidateAll() {
        int removed = deletePattern("sentiment:*") + deletePattern("history:*") + deletePattern("snipe:*");
        log.info("Cleared {} cache entries", removed);
    }

    public CacheStats stats() {
        try {
            return store.stats();
        } catch (RuntimeException e) {
            log.warn("Cache stats unavailable: {}", e.toString());
            metrics.recordCacheError();
            return new CacheStats("unavailable", 0, 0, 0, 0, 0, 0);
        }
    }

    private void delete(String key) {
        lastWritten.remove(key);
        try {
            store.delete(key);
        } catch (RuntimeException e) {
            log.warn("Cache delete failed for {}: {}", key, e.toString());
            metrics.recordCacheError();
        }
    }

    private int deletePattern(String pattern) {
        Pattern regex = InMemoryCacheStore.globToRegex(pattern);
        lastWritten.keySet().removeIf(key -> regex.matcher(key).matches());
        try {
            return store.deletePattern(pattern);
        } catch (RuntimeException e) {
            log.warn("Cache pattern delete failed for {}: {}", pattern, e.toString());
            metrics.recordCacheError();
            return 0;
        }
    }

    private <T> Optional<T> decode(String key, String raw, JavaType type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(raw, type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding undecodable cache entry {}: {}", key, e.getOriginalMessage());
            metrics.recordCacheError();
            return Optional.empty();
        }
    }

    private static String normalize(String token) {
        return token == null ? "" : token.trim().toUpperCase(Locale.ROOT);
    }
}
