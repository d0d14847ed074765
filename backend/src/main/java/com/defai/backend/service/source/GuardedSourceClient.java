package com.defai.backend.service.source;

import com.defai.backend.model.SignalResult;
import com.defai.backend.service.EngineMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs calls into signal sources and the classifier on the source executor, bounded by the
 * source time limiter and a per-source circuit breaker. Every failure mode turns into a
 * {@link SignalResult#fallback} carrying the caller's fallback value.
 */
@Slf4j
@Component
public class GuardedSourceClient {

    private final AsyncTaskExecutor sourceExecutor;
    private final TimeLimiter sourceTimeLimiter;
    private final CircuitBreakerRegistry circuitBreakers;
    private final EngineMetrics metrics;

    public GuardedSourceClient(@Qualifier("sourceExecutor") AsyncTaskExecutor sourceExecutor,
                               TimeLimiter sourceTimeLimiter,
                               CircuitBreakerRegistry circuitBreakers,
                               EngineMetrics metrics) {
        this.sourceExecutor = sourceExecutor;
        this.sourceTimeLimiter = sourceTimeLimiter;
        this.circuitBreakers = circuitBreakers;
        this.metrics = metrics;
    }

    public <T> SignalResult<T> fetch(String sourceName, String token, SignalSource<T> source, T fallback) {
        SignalResult<Optional<T>> result = call(sourceName, () -> source.fetch(token), Optional.empty());
        if (!result.isFresh()) {
            return SignalResult.fallback(fallback, result.getReason());
        }
        Optional<T> value = result.getValue();
        if (value == null || value.isEmpty()) {
            metrics.recordSourceFallback(sourceName, "no_data");
            return SignalResult.fallback(fallback, "no_data");
        }
        return SignalResult.fresh(value.get());
    }

    public <T> SignalResult<T> call(String sourceName, Callable<T> work, T fallback) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(sourceName);
        Callable<T> limited = () -> sourceTimeLimiter.executeFutureSupplier(() -> sourceExecutor.submit(work));
        try {
            return SignalResult.fresh(breaker.executeCallable(limited));
        } catch (CallNotPermittedException e) {
            return degrade(sourceName, "circuit_open", fallback, e);
        } catch (TimeoutException e) {
            return degrade(sourceName, "timeout", fallback, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degrade(sourceName, "interrupted", fallback, e);
        } catch (ExecutionException e) {
            return degrade(sourceName, "error", fallback, e.getCause() == null ? e : e.getCause());
        } catch (Exception e) {
            return degrade(sourceName, "error", fallback, e);
        }
    }

    private <T> SignalResult<T> degrade(String sourceName, String reason, T fallback, Throwable cause) {
        log.warn("Signal source {} degraded ({}): {}", sourceName, reason, cause.toString());
        metrics.recordSourceFallback(sourceName, reason);
        return SignalResult.fallback(fallback, reason);
    }
}
