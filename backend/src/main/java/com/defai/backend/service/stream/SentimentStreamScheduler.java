package com.defai.backend.service.stream;

import com.defai.backend.config.OracleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "oracle.stream.enabled", havingValue = "true", matchIfMissing = true)
public class SentimentStreamScheduler {

    private final SentimentStreamService streamService;
    private final OracleProperties properties;
    private final Clock clock;

    private volatile Instant pausedUntil = Instant.MIN;

    @Scheduled(fixedDelayString = "${oracle.stream.interval-seconds:5}", timeUnit = TimeUnit.SECONDS)
    public void runCycle() {
        Instant now = clock.instant();
        if (now.isBefore(pausedUntil)) {
            return;
        }
        try {
            streamService.pushUpdate();
        } catch (Exception e) {
            Duration backoff = Duration.ofSeconds(properties.getStream().getErrorBackoffSeconds());
            pausedUntil = now.plus(backoff);
            log.error("Sentiment stream cycle failed, pausing for {}s", backoff.toSeconds(), e);
        }
    }
}
