package com.defai.backend.service.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Process-local TTL store. Expired entries are dropped when read and by a periodic purge.
 */
@Slf4j
@Component
public class InMemoryCacheStore implements CacheStore {

    private final Clock clock;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong expirations = new AtomicLong();

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            if (entries.remove(key, entry)) {
                expirations.incrementAndGet();
                log.debug("CACHE_EXPIRED key={}", key);
            }
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Cache key and value are required");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be non-negative");
        }
        entries.put(key, new CacheEntry(key, value, clock.instant().plus(ttl)));
        sets.incrementAndGet();
    }

    @Override
    public boolean delete(String key) {
        boolean removed = entries.remove(key) != null;
        if (removed) {
            deletes.incrementAndGet();
        }
        return removed;
    }

    @Override
    public int deletePattern(String pattern) {
        Pattern regex = globToRegex(pattern);
        int removed = 0;
        for (String key : entries.keySet()) {
            if (regex.matcher(key).matches() && entries.remove(key) != null) {
                removed++;
            }
        }
        deletes.addAndGet(removed);
        return removed;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats("memory", entries.size(), hits.get(), misses.get(), sets.get(), deletes.get(),
                expirations.get());
    }

    @Scheduled(fixedDelayString = "${oracle.cache.purge-interval-seconds:60}", timeUnit = TimeUnit.SECONDS)
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(now) && entries.remove(entry.key(), entry)) {
                purged++;
            }
        }
        if (purged > 0) {
            expirations.addAndGet(purged);
            log.debug("Purged {} expired cache entries", purged);
        }
        return purged;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
