package com.defai.backend.service.scoring;

import com.defai.backend.model.ClassifiedPost;
import com.defai.backend.model.SentimentClass;
import com.defai.backend.model.SentimentLabel;
import com.defai.backend.model.SocialPost;
import com.defai.backend.model.TokenSentiment;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SentimentScorerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final SentimentScorer scorer = new SentimentScorer();

    @Test
    void emptyBatchFallsBackToNeutral() {
        TokenSentiment result = scorer.score("DOGE", List.of(), NOW);

        assertThat(result.sentimentScore()).isEqualTo(50.0);
        assertThat(result.confidence()).isZero();
        assertThat(result.sampleSize()).isZero();
        assertThat(result.sentimentLabel()).isEqualTo(SentimentLabel.NEUTRAL);
        assertThat(result.avgLikes()).isZero();
    }

    @Test
    void itemScoresStayInsideLabelBands() {
        assertThat(scorer.itemScore(SentimentClass.of(SentimentLabel.BEARISH, 1.0))).isEqualTo(33.0);
        assertThat(scorer.itemScore(SentimentClass.of(SentimentLabel.BEARISH, 0.0))).isEqualTo(0.0);
        assertThat(scorer.itemScore(SentimentClass.of(SentimentLabel.NEUTRAL, 0.0))).isEqualTo(34.0);
        assertThat(scorer.itemScore(SentimentClass.of(SentimentLabel.NEUTRAL, 1.0))).isEqualTo(67.0);
        assertThat(scorer.itemScore(SentimentClass.of(SentimentLabel.BULLISH, 1.0))).isEqualTo(100.0);
    }

    @Test
    void scoreIsMonotonicInLabelForFixedConfidence() {
        for (double confidence : new double[]{0.0, 0.3, 0.75, 1.0}) {
            double bearish = scorer.itemScore(SentimentClass.of(SentimentLabel.BEARISH, confidence));
            double neutral = scorer.itemScore(SentimentClass.of(SentimentLabel.NEUTRAL, confidence));
            double bullish = scorer.itemScore(SentimentClass.of(SentimentLabel.BULLISH, confidence));
            assertThat(bearish).isLessThan(neutral);
            assertThat(neutral).isLessThan(bullish);
        }
    }

    @Test
    void aggregatesCountsScoresAndEngagement() {
        List<ClassifiedPost> batch = List.of(
                post("to the moon", 10, 2, 1, SentimentLabel.BULLISH, 0.9),
                post("gem", 20, 4, 3, SentimentLabel.BULLISH, 0.8),
                post("meh", 0, 0, 2, SentimentLabel.NEUTRAL, 0.5),
                post("rug", 6, 0, 0, SentimentLabel.BEARISH, 0.6));

        TokenSentiment result = scorer.score("PEPE", batch, NOW);

        double expected = ((67 + 0.9 * 33) + (67 + 0.8 * 33) + (34 + 0.5 * 33) + (0.6 * 33)) / 4;
        assertThat(result.sentimentScore()).isCloseTo(expected, within(1e-9));
        assertThat(result.sampleSize()).isEqualTo(4);
        assertThat(result.bullishCount() + result.neutralCount() + result.bearishCount()).isEqualTo(4);
        assertThat(result.confidence()).isCloseTo((0.9 + 0.8 + 0.5 + 0.6) / 4, within(1e-9));
        assertThat(result.avgLikes()).isEqualTo(9.0);
        assertThat(result.avgRetweets()).isEqualTo(1.5);
        assertThat(result.avgReplies()).isEqualTo(1.5);
        assertThat(result.timestamp()).isEqualTo(NOW);
    }

    @Test
    void directionalLabelNeedsMoreVotesThanTheOthersCombined() {
        assertThat(scorer.majority(3, 1, 1)).isEqualTo(SentimentLabel.BULLISH);
        assertThat(scorer.majority(2, 1, 1)).isEqualTo(SentimentLabel.NEUTRAL);
        assertThat(scorer.majority(0, 1, 2)).isEqualTo(SentimentLabel.BEARISH);
        assertThat(scorer.majority(2, 0, 2)).isEqualTo(SentimentLabel.NEUTRAL);
        assertThat(scorer.majority(0, 0, 0)).isEqualTo(SentimentLabel.NEUTRAL);
    }

    @Test
    void snipeSentimentBalancesBullishAgainstBearishShare() {
        assertThat(scorer.snipeSentimentScore(List.of())).isEqualTo(50.0);
        assertThat(scorer.snipeSentimentScore(List.of(
                SentimentClass.of(SentimentLabel.BULLISH, 0.9),
                SentimentClass.of(SentimentLabel.BULLISH, 0.9),
                SentimentClass.of(SentimentLabel.NEUTRAL, 0.5),
                SentimentClass.of(SentimentLabel.BEARISH, 0.5)))).isEqualTo(87.5);
        assertThat(scorer.snipeSentimentScore(List.of(SentimentClass.of(SentimentLabel.BEARISH, 1.0)))).isZero();
    }

    private ClassifiedPost post(String text, long likes, long retweets, long replies,
                                SentimentLabel label, double confidence) {
        return new ClassifiedPost(new SocialPost(text, likes, retweets, replies, NOW),
                SentimentClass.of(label, confidence));
    }
}
