package com.defai.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "oracle.rate-limit")
@Data
public class RateLimitProperties {

    private boolean enabled = true;
    private Tier api = new Tier(100, 60);
    private Tier scan = new Tier(10, 60);
    private long idleSweepSeconds = 300;

    @Data
    public static class Tier {
        private int maxRequests;
        private long windowSeconds;

        public Tier() {
        }

        public Tier(int maxRequests, long windowSeconds) {
            this.maxRequests = maxRequests;
            this.windowSeconds = windowSeconds;
        }
    }
}
