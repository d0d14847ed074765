package com.defai.backend.service.cache;

import java.time.Instant;

public record CacheEntry(String key, String value, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
