package com.defai.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SourceResilienceConfig {

    @Bean
    public TimeLimiter sourceTimeLimiter(OracleProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(properties.getSources().getTimeoutMs()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("signal-source", config);
    }

    @Bean
    public CircuitBreakerRegistry sourceCircuitBreakers(OracleProperties properties) {
        OracleProperties.Circuit circuit = properties.getSources().getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .build();
        return CircuitBreakerRegistry.of(config);
    }
}
