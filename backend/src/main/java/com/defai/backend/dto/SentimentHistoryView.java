package com.defai.backend.dto;

import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SentimentHistoryView(
        String token,
        int hours,
        TrendDirection trend,
        double averageSentiment,
        double trendStrength,
        int count,
        List<TokenSentiment> entries
) {
}
