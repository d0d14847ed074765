package com.defai.backend.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;


/**
 * Outcome of producing a signal: a fresh value, a documented fallback used because
 * the real value could not be produced, or a failure with no usable value.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SignalResult<T> {

    public enum Status { FRESH, FALLBACK, FAILED }

    private final Status status;
    private final T value;
    private final String reason;

    public static <T> SignalResult<T> fresh(T value) {
        return new SignalResult<>(Status.FRESH, value, null);
    }

    public static <T> SignalResult<T> fallback(T value, String reason) {
        return new SignalResult<>(Status.FALLBACK, value, reason);
    }

    public static <T> SignalResult<T> failed(String reason) {
        return new SignalResult<>(Status.FAILED, null, reason);
    }

    public boolean isFresh() {
        return status == Status.FRESH;
    }

    public boolean isFallback() {
        return status == Status.FALLBACK;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public T orElse(T other) {
        return status == Status.FAILED ? other : value;
    }
}
