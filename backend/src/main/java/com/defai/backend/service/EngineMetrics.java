package com.defai.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class EngineMetrics {

    private final MeterRegistry meterRegistry;

    private Counter cacheHitsCounter;
    private Counter cacheMissesCounter;
    private Counter cacheErrorsCounter;
    private Counter rateLimitRejectionsCounter;
    private Counter broadcastDeliveriesCounter;
    private Counter broadcastFailuresCounter;
    private Timer analysisTimer;

    @jakarta.annotation.PostConstruct
    void init() {
        cacheHitsCounter = Counter.builder("cache_hits_total").register(meterRegistry);
        cacheMissesCounter = Counter.builder("cache_misses_total").register(meterRegistry);
        cacheErrorsCounter = Counter.builder("cache_errors_total").register(meterRegistry);
        rateLimitRejectionsCounter = Counter.builder("rate_limit_rejections_total").register(meterRegistry);
        broadcastDeliveriesCounter = Counter.builder("broadcast_deliveries_total").register(meterRegistry);
        broadcastFailuresCounter = Counter.builder("broadcast_failures_total").register(meterRegistry);
        analysisTimer = Timer.builder("sentiment_analysis_seconds").register(meterRegistry);
    }

    public void recordCacheHit() {
        if (cacheHitsCounter != null) {
            cacheHitsCounter.increment();
        }
    }

    public void recordCacheMiss() {
        if (cacheMissesCounter != null) {
            cacheMissesCounter.increment();
        }
    }

    public void recordCacheError() {
        if (cacheErrorsCounter != null) {
            cacheErrorsCounter.increment();
        }
    }

    public void recordRateLimitRejection() {
        if (rateLimitRejectionsCounter != null) {
            rateLimitRejectionsCounter.increment();
        }
    }

    public void recordBroadcast(int delivered, int failed) {
        if (broadcastDeliveriesCounter != null) {
            broadcastDeliveriesCounter.increment(delivered);
            broadcastFailuresCounter.increment(failed);
        }
    }

    public void recordAnalysis(Duration elapsed) {
        if (analysisTimer != null) {
            analysisTimer.record(elapsed);
        }
    }

    public void recordSourceFallback(String source, String reason) {
        Counter.builder("source_fallbacks_total")
                .tag("source", source)
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void registerGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(meterRegistry);
    }
}
