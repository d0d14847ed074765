package com.defai.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;

/**
 * Immutable sentiment snapshot for one token at one instant.
 */
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TokenSentiment(
        String token,
        Instant timestamp,
        double sentimentScore,
        SentimentLabel sentimentLabel,
        double confidence,
        int sampleSize,
        int bullishCount,
        int neutralCount,
        int bearishCount,
        double avgLikes,
        double avgRetweets,
        double avgReplies,
        TrendDirection trend,
        double trendStrength
) {
    public static TokenSentiment neutral(String token, Instant timestamp) {
        return TokenSentiment.builder()
                .token(token)
                .timestamp(timestamp)
                .sentimentScore(50.0)
                .sentimentLabel(SentimentLabel.NEUTRAL)
                .confidence(0.0)
                .sampleSize(0)
                .trend(TrendDirection.INSUFFICIENT_DATA)
                .trendStrength(0.0)
                .build();
    }
}
