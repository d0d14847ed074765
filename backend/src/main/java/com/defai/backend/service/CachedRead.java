package com.defai.backend.service;

/**
 * Value returned by a cache-aside read. {@code stale} marks a last-known value served because
 * the recompute was degraded; {@code degraded} marks a fallback value with nothing cached to replace it.
 */
public record CachedRead<T>(T data, boolean cached, boolean stale, boolean degraded) {

    public static <T> CachedRead<T> hit(T data) {
        return new CachedRead<>(data, true, false, false);
    }

    public static <T> CachedRead<T> computed(T data) {
        return new CachedRead<>(data, false, false, false);
    }

    public static <T> CachedRead<T> stale(T data) {
        return new CachedRead<>(data, true, true, true);
    }

    public static <T> CachedRead<T> fallback(T data) {
        return new CachedRead<>(data, false, false, true);
    }
}
