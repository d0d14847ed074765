package com.defai.backend.service.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-client sliding-window admission. Each client keeps the instants of its admitted
 * requests inside the last window; a request is admitted while fewer than {@code maxRequests}
 * remain in it. {@code remaining} counts the slot just taken, so the last admitted request
 * reports zero. Checks for the same client are serialised by the map's per-key compute.
 */
@Slf4j
@Component
public class SlidingWindowRateLimiter {

    private final Clock clock;
    private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public RateLimitDecision isAllowed(String clientId, int maxRequests, long windowSeconds) {
        return evaluate(clientId, maxRequests, windowSeconds, true);
    }

    /**
     * Reports the client's current standing without consuming a slot.
     */
    public RateLimitDecision peek(String clientId, int maxRequests, long windowSeconds) {
        return evaluate(clientId, maxRequests, windowSeconds, false);
    }

    private RateLimitDecision evaluate(String clientId, int maxRequests, long windowSeconds, boolean consume) {
        if (maxRequests < 0 || windowSeconds <= 0) {
            throw new IllegalArgumentException("maxRequests must be >= 0 and windowSeconds > 0");
        }
        long nowMs = clock.millis();
        long windowMs = windowSeconds * 1000L;
        long reset = Math.floorDiv(nowMs + windowMs, 1000L);
        RateLimitDecision[] decision = new RateLimitDecision[1];
        windows.compute(clientId, (id, existing) -> {
            RateWindow window = existing == null ? new RateWindow() : existing;
            window.prune(nowMs - windowMs);
            boolean allowed = window.size() < maxRequests;
            if (allowed && consume) {
                window.add(nowMs);
            }
            int remaining = Math.max(0, maxRequests - window.size());
            long retryAfter = allowed ? 0 : window.retryAfterSeconds(nowMs, windowMs);
            decision[0] = new RateLimitDecision(allowed, maxRequests, remaining, reset, retryAfter);
            return window.isEmpty() && existing == null ? null : window;
        });
        return decision[0];
    }

    /**
     * Drops windows whose newest request is older than {@code idleAfter}.
     */
    public int sweepIdle(Duration idleAfter) {
        long cutoff = clock.millis() - idleAfter.toMillis();
        int before = windows.size();
        for (String clientId : windows.keySet()) {
            windows.computeIfPresent(clientId, (id, window) -> window.lastRequestMs() < cutoff ? null : window);
        }
        int removed = before - windows.size();
        if (removed > 0) {
            log.debug("Swept {} idle rate-limit windows", removed);
        }
        return Math.max(0, removed);
    }

    public int trackedClients() {
        return windows.size();
    }

    private static final class RateWindow {
        private final Deque<Long> requests = new ArrayDeque<>();

        void prune(long cutoffMs) {
            while (!requests.isEmpty() && requests.peekFirst() < cutoffMs) {
                requests.pollFirst();
            }
        }

        void add(long nowMs) {
            requests.addLast(nowMs);
        }

        int size() {
            return requests.size();
        }

        boolean isEmpty() {
            return requests.isEmpty();
        }

        long lastRequestMs() {
            Long last = requests.peekLast();
            return last == null ? Long.MIN_VALUE : last;
        }

        long retryAfterSeconds(long nowMs, long windowMs) {
            Long oldest = requests.peekFirst();
            if (oldest == null) {
                return 1;
            }
            long waitMs = oldest + windowMs - nowMs;
            return Math.max(1, (waitMs + 999) / 1000);
        }
    }
}
