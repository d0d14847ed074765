package com.defai.backend.service.scoring;

import com.defai.backend.model.DevWalletAnalysis;
import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.LiquidityMetrics;
import com.defai.backend.model.Prediction;
import com.defai.backend.model.SentimentClass;
import com.defai.backend.model.SnipeSignal;
import com.defai.backend.model.TokenProfile;
import com.defai.backend.model.VolumeAnalysis;
import com.defai.backend.model.VolumeMetrics;
import com.defai.backend.model.VolumeTrend;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Combines the partial signals of one token into a {@link SnipeSignal}. Any missing input
 * contributes a zero sub-score, except sentiment which falls back to neutral.
 */
@Component
@RequiredArgsConstructor
public class SnipeScorer {

    static final double VOLUME_WEIGHT = 0.30;
    static final double SENTIMENT_WEIGHT = 0.25;
    static final double DEV_WALLET_WEIGHT = 0.25;
    static final double LIQUIDITY_WEIGHT = 0.20;

    private final VolumeAnalyzer volumeAnalyzer;
    private final DevWalletAnalyzer devWalletAnalyzer;
    private final SentimentScorer sentimentScorer;

    public SnipeSignal score(TokenProfile profile,
                             VolumeMetrics volume,
                             LiquidityMetrics liquidity,
                             DevWalletMetrics wallets,
                             List<SentimentClass> sentiments,
                             Instant analysisTimestamp) {
        VolumeAnalysis volumeAnalysis = volume == null ? null : volumeAnalyzer.analyze(volume);
        double volumeScore = volume == null ? 0.0 : volumeAnalyzer.volumeScore(volume, volumeAnalysis);

        double sentimentScore = sentimentScorer.snipeSentimentScore(sentiments);

        DevWalletAnalysis walletAnalysis = wallets == null ? null : devWalletAnalyzer.analyze(wallets);
        double devWalletScore = walletAnalysis == null ? 0.0 : devWalletAnalyzer.devWalletScore(walletAnalysis);

        double liquidityUsd = resolveLiquidity(liquidity, volume);
        double liquidityScore = liquidity == null && volume == null ? 0.0 : liquidityScore(liquidityUsd);

        double overall = overallScore(volumeScore, sentimentScore, devWalletScore, liquidityScore);
        Prediction prediction = predict(overall, volumeScore, sentimentScore);

        List<String> signals = keySignals(volume, volumeAnalysis, sentimentScore, devWalletScore);
        List<String> risks = risks(volume, liquidityUsd, devWalletScore);

        return SnipeSignal.builder()
                .tokenSymbol(profile.symbol())
                .tokenAddress(profile.address())
                .tokenName(profile.name())
                .dex(profile.dex())
                .poolAddress(profile.poolAddress())
                .volumeScore(volumeScore)
                .sentimentScore(sentimentScore)
                .devWalletScore(devWalletScore)
                .liquidityScore(liquidityScore)
                .overallScore(overall)
                .prediction(prediction)
                .confidence(overall)
                .keySignals(signals)
                .risks(risks)
                .recommendation(recommendation(prediction, overall, risks.size()))
                .createdAt(profile.createdAt())
                .analysisTimestamp(analysisTimestamp)
                .build();
    }

    public double liquidityScore(double liquidityUsd) {
        if (liquidityUsd < 10_000) {
            return 20;
        }
        if (liquidityUsd < 50_000) {
            return 40;
        }
        if (liquidityUsd < 100_000) {
            return 60;
        }
        if (liquidityUsd < 500_000) {
            return 80;
        }
        return 100;
    }

    public double overallScore(double volume, double sentiment, double devWallet, double liquidity) {
        return ScoreMath.clampScore(VOLUME_WEIGHT * volume
                + SENTIMENT_WEIGHT * sentiment
                + DEV_WALLET_WEIGHT * devWallet
                + LIQUIDITY_WEIGHT * liquidity);
    }

    /**
     * First matching tier wins, best first.
     */
    public Prediction predict(double overall, double volume, double sentiment) {
        if (overall > 80 && volume > 70 && sentiment > 70) {
            return Prediction.X100;
        }
        if (overall > 70 && volume > 60) {
            return Prediction.X10;
        }
        if (overall > 60) {
            return Prediction.X5;
        }
        if (overall > 50) {
            return Prediction.X2;
        }
        if (overall > 40) {
            return Prediction.HOLD;
        }
        return Prediction.AVOID;
    }

    private double resolveLiquidity(LiquidityMetrics liquidity, VolumeMetrics volume) {
        if (liquidity != null) {
            return liquidity.liquidityUsd();
        }
        return volume == null ? 0.0 : volume.liquidityUsd();
    }

    private List<String> keySignals(VolumeMetrics volume, VolumeAnalysis analysis, double sentimentScore,
                                    double devWalletScore) {
        List<String> signals = new ArrayList<>();
        if (analysis != null && analysis.volumeTrend() == VolumeTrend.INCREASING) {
            signals.add("Volume increasing rapidly");
        }
        if (analysis != null && analysis.buyPressure() > 70) {
            signals.add("Strong buy pressure");
        }
        if (volume != null && volume.priceChange5m() > 5) {
            signals.add("Price up 5%+ in 5m");
        }
        if (sentimentScore > 70) {
            signals.add("Positive social sentiment");
        }
        if (devWalletScore > 70) {
            signals.add("Legitimate dev wallets");
        }
        return signals;
    }

    private List<String> risks(VolumeMetrics volume, double liquidityUsd, double devWalletScore) {
        List<String> risks = new ArrayList<>();
        if (liquidityUsd < 50_000) {
            risks.add("Low liquidity (<$50k)");
        }
        if (volume != null && volume.volume24h() < 100_000) {
            risks.add("Low 24h volume");
        }
        if (devWalletScore < 50) {
            risks.add("Suspicious dev wallets");
        }
        return risks;
    }

    private String recommendation(Prediction prediction, double confidence, int riskCount) {
        String pct = String.format(Locale.ROOT, "%.0f", confidence);
        return switch (prediction) {
            case X100 -> "SNIPE SIGNAL: " + pct + "% confidence. Monitor for entry. " + riskCount + " risks identified.";
            case X10 -> "STRONG BUY: " + pct + "% confidence. Good risk/reward.";
            case X5 -> "BUY: " + pct + "% confidence. Decent potential.";
            case X2 -> "HOLD: " + pct + "% confidence. Limited upside.";
            case HOLD, AVOID -> "AVOID: " + pct + "% confidence. Too risky.";
        };
    }
}
