package com.defai.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DevWalletAnalysis(
        double clusteringScore,
        RiskLevel riskLevel,
        List<String> suspiciousPatterns,
        String recommendation
) {
    public DevWalletAnalysis {
        suspiciousPatterns = suspiciousPatterns == null ? List.of() : List.copyOf(suspiciousPatterns);
    }
}
