package com.defai.backend.service;

import com.defai.backend.config.RateLimitProperties;
import com.defai.backend.service.ratelimit.RateLimitDecision;
import com.defai.backend.service.ratelimit.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitService {

    private final RateLimitProperties properties;
    private final SlidingWindowRateLimiter limiter;
    private final EngineMetrics metrics;

    public RateLimitDecision allowApi(String clientId) {
        return check("api:" + clientId, properties.getApi());
    }

    public RateLimitDecision allowScan(String clientId) {
        return check("scan:" + clientId, properties.getScan());
    }

    public RateLimitDecision peekApi(String clientId) {
        RateLimitProperties.Tier tier = properties.getApi();
        return limiter.peek("api:" + clientId, tier.getMaxRequests(), tier.getWindowSeconds());
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Scheduled(fixedDelayString = "${oracle.rate-limit.idle-sweep-seconds:300}", timeUnit = TimeUnit.SECONDS)
    public void sweepIdleClients() {
        limiter.sweepIdle(Duration.ofSeconds(properties.getIdleSweepSeconds()));
    }

    private RateLimitDecision check(String key, RateLimitProperties.Tier tier) {
        RateLimitDecision decision = limiter.isAllowed(key, tier.getMaxRequests(), tier.getWindowSeconds());
        if (!decision.allowed()) {
            metrics.recordRateLimitRejection();
            log.info("Rate limit exceeded for {} (limit={}, reset={})", key, decision.limit(), decision.reset());
        }
        return decision;
    }
}
