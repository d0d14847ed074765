package com.defai.backend.dto;

import com.defai.backend.service.CachedRead;

import java.time.Instant;

public record DataResponse<T>(boolean success, boolean cached, boolean stale, boolean degraded, Instant timestamp, T data) {

    public static <T> DataResponse<T> of(CachedRead<T> read, Instant timestamp) {
        return new DataResponse<>(true, read.cached(), read.stale(), read.degraded(), timestamp, read.data());
    }

    public static <T> DataResponse<T> ok(T data, Instant timestamp) {
        return new DataResponse<>(true, false, false, false, timestamp, data);
    }
}
