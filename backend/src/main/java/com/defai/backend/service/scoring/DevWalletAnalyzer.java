package com.defai.backend.service.scoring;

import com.defai.backend.model.DevWalletAnalysis;
import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how tightly the developer wallet balances cluster. Near-identical balances across
 * several wallets read as one actor splitting holdings.
 */
@Component
public class DevWalletAnalyzer {

    static final String MULTIPLE_WALLETS = "Multiple dev wallets detected";
    static final String DEPLOYER_MAJORITY = "Deployer holds >50% of tokens";

    public double clusteringScore(List<Double> balances) {
        if (balances == null || balances.size() < 2) {
            return 0.0;
        }
        double mean = balances.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (mean <= 0) {
            return 0.0;
        }
        double variance = balances.stream()
                .mapToDouble(balance -> (balance - mean) * (balance - mean))
                .sum() / balances.size();
        double coefficientOfVariation = Math.sqrt(variance) / mean;
        return ScoreMath.clampScore(100.0 - coefficientOfVariation * 100.0);
    }

    public DevWalletAnalysis analyze(DevWalletMetrics metrics) {
        List<Double> balances = metrics.balances();
        double clustering = clusteringScore(balances);

        List<String> patterns = new ArrayList<>();
        if (balances.size() > 3) {
            patterns.add(MULTIPLE_WALLETS);
        }
        Double deployer = metrics.deployerBalance();
        if (deployer != null && deployer > 0) {
            double total = balances.stream().mapToDouble(Double::doubleValue).sum() + deployer;
            if (deployer / total > 0.5) {
                patterns.add(DEPLOYER_MAJORITY);
            }
        }

        RiskLevel risk;
        if (clustering > 70 || patterns.size() > 2) {
            risk = RiskLevel.HIGH;
        } else if (clustering > 40 || !patterns.isEmpty()) {
            risk = RiskLevel.MEDIUM;
        } else {
            risk = RiskLevel.LOW;
        }
        return new DevWalletAnalysis(clustering, risk, patterns, recommendation(risk));
    }

    /**
     * Legitimacy sub-score used by the snipe composite.
     */
    public double devWalletScore(DevWalletAnalysis analysis) {
        return ScoreMath.clampScore(100.0 - analysis.clusteringScore());
    }

    private String recommendation(RiskLevel risk) {
        return switch (risk) {
            case HIGH -> "HIGH RISK: Avoid this token. Suspicious dev wallet clustering detected.";
            case MEDIUM -> "MEDIUM RISK: Proceed with caution. Monitor dev wallet activity.";
            case LOW -> "LOW RISK: Dev wallet distribution looks healthy.";
        };
    }
}
