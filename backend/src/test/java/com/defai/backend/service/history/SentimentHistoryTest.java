package com.defai.backend.service.history;

import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;
import com.defai.backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SentimentHistoryTest {

    private static final Duration DAY = Duration.ofHours(24);

    private final MutableClock clock = MutableClock.at("2024-05-01T00:00:00Z");

    @Test
    void trendNeedsTwoEntriesInsideWindow() {
        SentimentHistory history = new SentimentHistory("DOGE", 500, clock);

        assertThat(history.trend(DAY)).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
        history.record(draft(40), DAY);
        assertThat(history.trend(DAY)).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
    }

    @Test
    void trendComparesFirstAndLastInsideWindow() {
        SentimentHistory history = new SentimentHistory("DOGE", 500, clock);
        history.record(draft(40), DAY);
        clock.advance(Duration.ofHours(1));
        history.record(draft(60), DAY);

        assertThat(history.trend(DAY)).isEqualTo(TrendDirection.RISING);

        clock.advance(Duration.ofHours(1));
        history.record(draft(30), DAY);
        assertThat(history.trend(DAY)).isEqualTo(TrendDirection.FALLING);

        clock.advance(Duration.ofHours(1));
        history.record(draft(43), DAY);
        assertThat(history.trend(DAY)).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void entriesOutsideWindowAreIgnored() {
        SentimentHistory history = new SentimentHistory("DOGE", 500, clock);
        history.record(draft(10), DAY);
        clock.advance(Duration.ofHours(30));
        history.record(draft(70), DAY);
        clock.advance(Duration.ofMinutes(5));
        history.record(draft(72), DAY);

        assertThat(history.trend(DAY)).isEqualTo(TrendDirection.STABLE);
        assertThat(history.averageSentiment(DAY)).isCloseTo(71.0, within(1e-9));
        assertThat(history.within(DAY)).hasSize(2);
    }

    @Test
    void averageOfEmptyWindowIsNeutral() {
        SentimentHistory history = new SentimentHistory("DOGE", 500, clock);

        assertThat(history.averageSentiment(DAY)).isEqualTo(50.0);
    }

    @Test
    void recordedSnapshotCarriesTrendIncludingItself() {
        SentimentHistory history = new SentimentHistory("DOGE", 500, clock);
        TokenSentiment first = history.record(draft(40), DAY);
        clock.advance(Duration.ofMinutes(1));
        TokenSentiment second = history.record(draft(65), DAY);

        assertThat(first.trend()).isEqualTo(TrendDirection.INSUFFICIENT_DATA);
        assertThat(first.trendStrength()).isZero();
        assertThat(second.trend()).isEqualTo(TrendDirection.RISING);
        assertThat(second.trendStrength()).isCloseTo(0.5, within(1e-9));
        assertThat(second.timestamp()).isEqualTo(clock.instant());
        assertThat(history.latest()).contains(second);
    }

    @Test
    void trendStrengthUsesLastTenEntriesAndCapsAtOne() {
        SentimentHistory history = new SentimentHistory("DOGE", 500, clock);
        history.record(draft(0), DAY);
        for (int i = 0; i < 10; i++) {
            history.record(draft(50), DAY);
        }
        assertThat(history.trendStrength()).isZero();

        history.record(draft(100), DAY);
        assertThat(history.trendStrength()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void capacityEvictsOldestEntries() {
        SentimentHistory history = new SentimentHistory("DOGE", 3, clock);
        for (int score = 1; score <= 5; score++) {
            history.record(draft(score), DAY);
            clock.advanceSeconds(1);
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.snapshot()).extracting(TokenSentiment::sentimentScore).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    void concurrentRecordsAreAllAppendedInTimestampOrder() throws Exception {
        SentimentHistory history = new SentimentHistory("DOGE", 1_000, clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            double score = i % 100;
            tasks.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                clock.advance(Duration.ofMillis(1));
                history.record(draft(score), DAY);
            });
        }
        tasks.forEach(executor::submit);
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        List<TokenSentiment> entries = history.snapshot();
        assertThat(entries).hasSize(200);
        for (int i = 1; i < entries.size(); i++) {
            assertThat(entries.get(i).timestamp()).isAfterOrEqualTo(entries.get(i - 1).timestamp());
        }
    }

    private TokenSentiment draft(double score) {
        return TokenSentiment.neutral("DOGE", null).toBuilder().sentimentScore(score).sampleSize(1).build();
    }
}
