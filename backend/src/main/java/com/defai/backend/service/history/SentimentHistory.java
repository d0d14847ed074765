package com.defai.backend.service.history;

import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, capacity-bounded sequence of snapshots for one token. The oldest entry is
 * evicted once capacity is reached. Entries are never modified after they are appended.
 */
public class SentimentHistory {

    static final double TREND_THRESHOLD = 5.0;
    static final int STRENGTH_LOOKBACK = 10;
    static final double STRENGTH_SCALE = 50.0;

    private final String token;
    private final int capacity;
    private final Clock clock;
    private final Deque<TokenSentiment> entries = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SentimentHistory(String token, int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive");
        }
        this.token = token;
        this.capacity = capacity;
        this.clock = clock;
    }

    public String token() {
        return token;
    }

    /**
     * Stamps the draft with the current instant, derives trend and strength over the stored
     * entries plus the draft, and appends the enriched snapshot.
     */
    public TokenSentiment record(TokenSentiment draft, Duration trendWindow) {
        lock.lock();
        try {
            Instant now = clock.instant();
            TokenSentiment stamped = draft.toBuilder().token(token).timestamp(now).build();
            List<TokenSentiment> candidate = new ArrayList<>(entries.size() + 1);
            candidate.addAll(entries);
            candidate.add(stamped);
            TokenSentiment enriched = stamped.toBuilder()
                    .trend(trendOf(candidate, now.minus(trendWindow)))
                    .trendStrength(strengthOf(candidate))
                    .build();
            appendLocked(enriched);
            return enriched;
        } finally {
            lock.unlock();
        }
    }

    public TrendDirection trend(Duration window) {
        return trendOf(snapshot(), clock.instant().minus(window));
    }

    public double averageSentiment(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return snapshot().stream()
                .filter(entry -> entry.timestamp().isAfter(cutoff))
                .mapToDouble(TokenSentiment::sentimentScore)
                .average()
                .orElse(50.0);
    }

    public double trendStrength() {
        return strengthOf(snapshot());
    }

    public List<TokenSentiment> within(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return snapshot().stream()
                .filter(entry -> entry.timestamp().isAfter(cutoff))
                .toList();
    }

    public Optional<TokenSentiment> latest() {
        lock.lock();
        try {
            return Optional.ofNullable(entries.peekLast());
        } finally {
            lock.unlock();
        }
    }

    public List<TokenSentiment> snapshot() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    static TrendDirection trendOf(List<TokenSentiment> entries, Instant cutoff) {
        List<TokenSentiment> recent = entries.stream()
                .filter(entry -> entry.timestamp().isAfter(cutoff))
                .toList();
        if (recent.size() < 2) {
            return TrendDirection.INSUFFICIENT_DATA;
        }
        double first = recent.get(0).sentimentScore();
        double last = recent.get(recent.size() - 1).sentimentScore();
        if (last > first + TREND_THRESHOLD) {
            return TrendDirection.RISING;
        }
        if (last < first - TREND_THRESHOLD) {
            return TrendDirection.FALLING;
        }
        return TrendDirection.STABLE;
    }

    static double strengthOf(List<TokenSentiment> entries) {
        if (entries.size() < 2) {
            return 0.0;
        }
        List<TokenSentiment> tail = entries.subList(Math.max(0, entries.size() - STRENGTH_LOOKBACK), entries.size());
        double change = Math.abs(tail.get(tail.size() - 1).sentimentScore() - tail.get(0).sentimentScore());
        return Math.min(change / STRENGTH_SCALE, 1.0);
    }

    private void appendLocked(TokenSentiment snapshot) {
        entries.addLast(snapshot);
        while (entries.size() > capacity) {
            entries.pollFirst();
        }
    }
}
