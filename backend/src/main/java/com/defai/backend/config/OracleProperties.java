package com.defai.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    private Tokens tokens = new Tokens();
    private Sentiment sentiment = new Sentiment();
    private Sources sources = new Sources();
    private Cache cache = new Cache();
    private Stream stream = new Stream();
    private Cors cors = new Cors();

    @Data
    public static class Tokens {
        private List<String> initial = new ArrayList<>(List.of("DOGE", "SHIB", "PEPE"));
    }

    @Data
    public static class Sentiment {
        private int historyCapacity = 500;
        private int trendWindowHours = 24;
        private int maxPosts = 100;
        private String exportDirectory = "data";
    }

    @Data
    public static class Sources {
        private long timeoutMs = 2000;
        private Circuit circuit = new Circuit();
    }

    @Data
    public static class Circuit {
        private float failureRateThreshold = 50;
        private long waitOpenSeconds = 30;
        private int slidingWindowSize = 20;
    }

    @Data
    public static class Cache {
        private long defaultTtlSeconds = 300;
        private long historyTtlSeconds = 3600;
        private long purgeIntervalSeconds = 60;
    }

    @Data
    public static class Stream {
        private boolean enabled = true;
        private long intervalSeconds = 5;
        private long errorBackoffSeconds = 5;
        private int sendTimeLimitMs = 5000;
        private int bufferSizeLimit = 512 * 1024;
        private List<String> allowedOrigins = new ArrayList<>();
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "DELETE", "OPTIONS"));
    }
}
