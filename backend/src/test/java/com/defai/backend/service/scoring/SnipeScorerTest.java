package com.defai.backend.service.scoring;

import com.defai.backend.model.DevWalletMetrics;
import com.defai.backend.model.LiquidityMetrics;
import com.defai.backend.model.Prediction;
import com.defai.backend.model.SentimentClass;
import com.defai.backend.model.SentimentLabel;
import com.defai.backend.model.SnipeSignal;
import com.defai.backend.model.TokenProfile;
import com.defai.backend.model.VolumeMetrics;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SnipeScorerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final SnipeScorer scorer = new SnipeScorer(new VolumeAnalyzer(), new DevWalletAnalyzer(), new SentimentScorer());

    @Test
    void predictionTiersMatchTopDown() {
        assertThat(scorer.predict(85, 75, 75)).isEqualTo(Prediction.X100);
        assertThat(scorer.predict(85, 75, 60)).isEqualTo(Prediction.X10);
        assertThat(scorer.predict(65, 30, 50)).isEqualTo(Prediction.X5);
        assertThat(scorer.predict(55, 90, 90)).isEqualTo(Prediction.X2);
        assertThat(scorer.predict(45, 0, 0)).isEqualTo(Prediction.HOLD);
        assertThat(scorer.predict(35, 90, 90)).isEqualTo(Prediction.AVOID);
    }

    @Test
    void liquidityScoreSteps() {
        assertThat(scorer.liquidityScore(5_000)).isEqualTo(20);
        assertThat(scorer.liquidityScore(10_000)).isEqualTo(40);
        assertThat(scorer.liquidityScore(75_000)).isEqualTo(60);
        assertThat(scorer.liquidityScore(250_000)).isEqualTo(80);
        assertThat(scorer.liquidityScore(2_000_000)).isEqualTo(100);
    }

    @Test
    void overallIsWeightedSum() {
        assertThat(scorer.overallScore(100, 100, 100, 100)).isCloseTo(100.0, within(1e-9));
        assertThat(scorer.overallScore(80, 60, 40, 20)).isCloseTo(0.3 * 80 + 0.25 * 60 + 0.25 * 40 + 0.2 * 20, within(1e-9));
    }

    @Test
    void strongTokenProducesTopTierSignal() {
        VolumeMetrics volume = VolumeMetrics.builder()
                .volume5m(60_000).volume1h(30_000).volume24h(900_000)
                .liquidityUsd(800_000).price(0.002).priceChange5m(50)
                .build();
        DevWalletMetrics wallets = new DevWalletMetrics(List.of(10.0, 5_000.0, 90.0), null);
        List<SentimentClass> sentiments = Collections.nCopies(10, SentimentClass.of(SentimentLabel.BULLISH, 0.9));

        SnipeSignal signal = scorer.score(profile(), volume, null, wallets, sentiments, NOW);

        assertThat(signal.volumeScore()).isEqualTo(100.0);
        assertThat(signal.sentimentScore()).isEqualTo(100.0);
        assertThat(signal.liquidityScore()).isEqualTo(100.0);
        assertThat(signal.overallScore()).isGreaterThan(80.0);
        assertThat(signal.prediction()).isEqualTo(Prediction.X100);
        assertThat(signal.confidence()).isEqualTo(signal.overallScore());
        assertThat(signal.keySignals()).containsExactly(
                "Volume increasing rapidly",
                "Strong buy pressure",
                "Price up 5%+ in 5m",
                "Positive social sentiment",
                "Legitimate dev wallets");
        assertThat(signal.risks()).isEmpty();
        assertThat(signal.recommendation()).startsWith("SNIPE SIGNAL:").endsWith("0 risks identified.");
        assertThat(signal.tokenSymbol()).isEqualTo("PEPE");
        assertThat(signal.analysisTimestamp()).isEqualTo(NOW);
    }

    @Test
    void missingInputsScoreZeroAndAvoid() {
        SnipeSignal signal = scorer.score(profile(), null, null, null, List.of(), NOW);

        assertThat(signal.volumeScore()).isZero();
        assertThat(signal.devWalletScore()).isZero();
        assertThat(signal.liquidityScore()).isZero();
        assertThat(signal.sentimentScore()).isEqualTo(50.0);
        assertThat(signal.overallScore()).isCloseTo(12.5, within(1e-9));
        assertThat(signal.prediction()).isEqualTo(Prediction.AVOID);
        assertThat(signal.risks()).containsExactly("Low liquidity (<$50k)", "Suspicious dev wallets");
        assertThat(signal.recommendation()).startsWith("AVOID:");
    }

    @Test
    void explicitLiquidityOverridesVolumeReportedLiquidity() {
        VolumeMetrics volume = VolumeMetrics.builder().volume24h(50_000).liquidityUsd(1_000).build();

        SnipeSignal signal = scorer.score(profile(), volume, new LiquidityMetrics(300_000), null, List.of(), NOW);

        assertThat(signal.liquidityScore()).isEqualTo(80.0);
        assertThat(signal.risks()).containsExactly("Low 24h volume", "Suspicious dev wallets");
    }

    @Test
    void everySubScoreStaysInRange() {
        VolumeMetrics extreme = VolumeMetrics.builder()
                .volume5m(1e12).volume1h(1).volume24h(1e12).liquidityUsd(1e12).priceChange5m(1e6)
                .build();

        SnipeSignal signal = scorer.score(profile(), extreme, null,
                new DevWalletMetrics(List.of(1.0, 1e9), 1e12), List.of(), NOW);

        for (double score : new double[]{signal.volumeScore(), signal.sentimentScore(), signal.devWalletScore(),
                signal.liquidityScore(), signal.overallScore(), signal.confidence()}) {
            assertThat(score).isBetween(0.0, 100.0);
        }
    }

    private TokenProfile profile() {
        return TokenProfile.builder().symbol("PEPE").name("Pepe").dex("uniswap").address("0xabc").build();
    }
}
