package com.defai.backend.dto;

import com.defai.backend.model.TrendDirection;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SentimentSummary(Instant timestamp, Map<String, TokenSummary> tokens) {

    public static final String NO_DATA = "no_data";

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TokenSummary(
            String sentiment,
            double score,
            double confidence,
            int sampleSize,
            TrendDirection trend,
            double trendStrength,
            @JsonProperty("avg_sentiment_24h") double avgSentiment24h,
            Instant lastUpdated
    ) {
        public static TokenSummary noData() {
            return new TokenSummary(NO_DATA, 50.0, 0.0, 0, TrendDirection.INSUFFICIENT_DATA, 0.0, 50.0, null);
        }
    }
}
