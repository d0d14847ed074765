package com.defai.backend.service.source;

import com.defai.backend.model.SignalResult;
import com.defai.backend.support.TestFixtures;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GuardedSourceClientTest {

    private ThreadPoolTaskExecutor executor;
    private GuardedSourceClient client;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("source-test-");
        executor.initialize();
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(100))
                .cancelRunningFuture(true)
                .build());
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        client = new GuardedSourceClient(executor, timeLimiter, breakers, TestFixtures.metrics());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void returnsFreshValue() {
        SignalResult<Integer> result = client.fetch("volume", "DOGE", token -> Optional.of(42), 0);

        assertThat(result.isFresh()).isTrue();
        assertThat(result.getValue()).isEqualTo(42);
    }

    @Test
    void emptySourceFallsBackAsNoData() {
        SignalResult<Integer> result = client.fetch("volume", "DOGE", token -> Optional.empty(), 0);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.getValue()).isZero();
        assertThat(result.getReason()).isEqualTo("no_data");
    }

    @Test
    void failingSourceFallsBackAsError() {
        SignalResult<Integer> result = client.fetch("volume", "DOGE", token -> {
            throw new IOException("upstream 502");
        }, -1);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.getValue()).isEqualTo(-1);
        assertThat(result.getReason()).isEqualTo("error");
    }

    @Test
    void slowSourceIsCutOffByTimeout() {
        long started = System.nanoTime();

        SignalResult<String> result = client.call("classifier", () -> {
            Thread.sleep(5_000);
            return "late";
        }, "neutral");

        assertThat(result.getValue()).isEqualTo("neutral");
        assertThat(result.getReason()).isEqualTo("timeout");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    void repeatedFailuresOpenTheCircuit() {
        SignalSource<Integer> broken = token -> {
            throw new IllegalStateException("down");
        };
        client.fetch("wallets", "DOGE", broken, 0);
        client.fetch("wallets", "DOGE", broken, 0);

        SignalResult<Integer> result = client.fetch("wallets", "DOGE", token -> Optional.of(1), 0);

        assertThat(result.getReason()).isEqualTo("circuit_open");
        assertThat(client.fetch("volume", "DOGE", token -> Optional.of(1), 0).isFresh()).isTrue();
    }
}
