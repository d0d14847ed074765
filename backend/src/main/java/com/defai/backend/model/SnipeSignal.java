package com.defai.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Composite scan result for one token. A newer scan supersedes it; it is never updated.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SnipeSignal(
        String tokenSymbol,
        String tokenAddress,
        String tokenName,
        String dex,
        String poolAddress,
        double volumeScore,
        double sentimentScore,
        double devWalletScore,
        double liquidityScore,
        double overallScore,
        Prediction prediction,
        double confidence,
        List<String> keySignals,
        List<String> risks,
        String recommendation,
        Instant createdAt,
        Instant analysisTimestamp
) {
    public SnipeSignal {
        keySignals = keySignals == null ? List.of() : List.copyOf(keySignals);
        risks = risks == null ? List.of() : List.copyOf(risks);
    }
}
