package com.defai.backend.service.scoring;

import com.defai.backend.model.ClassifiedPost;
import com.defai.backend.model.SentimentClass;
import com.defai.backend.model.SentimentLabel;
import com.defai.backend.model.SocialPost;
import com.defai.backend.model.TokenSentiment;
import com.defai.backend.model.TrendDirection;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Folds a batch of classified posts into a {@link TokenSentiment}. Trend fields are left at
 * their defaults; the history fills them in when the snapshot is recorded.
 */
@Component
public class SentimentScorer {

    public static final double NEUTRAL_SCORE = 50.0;

    private static final double BAND = 33.0;
    private static final double NEUTRAL_FLOOR = 34.0;
    private static final double BULLISH_FLOOR = 67.0;

    /**
     * Maps one classification into its label band: bearish [0,33], neutral [34,67], bullish [67,100].
     */
    public double itemScore(SentimentClass sentiment) {
        double score = switch (sentiment.label()) {
            case BEARISH -> sentiment.confidence() * BAND;
            case NEUTRAL -> NEUTRAL_FLOOR + sentiment.confidence() * BAND;
            case BULLISH -> BULLISH_FLOOR + sentiment.confidence() * BAND;
        };
        return ScoreMath.clampScore(score);
    }

    public TokenSentiment score(String token, List<ClassifiedPost> batch, Instant timestamp) {
        if (batch == null || batch.isEmpty()) {
            return TokenSentiment.neutral(token, timestamp);
        }
        int bullish = 0;
        int neutral = 0;
        int bearish = 0;
        double scoreSum = 0.0;
        double confidenceSum = 0.0;
        double likes = 0.0;
        double retweets = 0.0;
        double replies = 0.0;
        for (ClassifiedPost item : batch) {
            SentimentClass sentiment = item.sentiment();
            switch (sentiment.label()) {
                case BULLISH -> bullish++;
                case NEUTRAL -> neutral++;
                case BEARISH -> bearish++;
            }
            scoreSum += itemScore(sentiment);
            confidenceSum += sentiment.confidence();
            SocialPost post = item.post();
            if (post != null) {
                likes += post.likes();
                retweets += post.retweets();
                replies += post.replies();
            }
        }
        int n = batch.size();
        return TokenSentiment.builder()
                .token(token)
                .timestamp(timestamp)
                .sentimentScore(ScoreMath.clampScore(scoreSum / n))
                .sentimentLabel(majority(bullish, neutral, bearish))
                .confidence(ScoreMath.clamp(confidenceSum / n, 0.0, 1.0))
                .sampleSize(n)
                .bullishCount(bullish)
                .neutralCount(neutral)
                .bearishCount(bearish)
                .avgLikes(likes / n)
                .avgRetweets(retweets / n)
                .avgReplies(replies / n)
                .trend(TrendDirection.INSUFFICIENT_DATA)
                .trendStrength(0.0)
                .build();
    }

    /**
     * A directional label needs more votes than the other two labels combined.
     */
    public SentimentLabel majority(int bullish, int neutral, int bearish) {
        if (bullish > neutral + bearish) {
            return SentimentLabel.BULLISH;
        }
        if (bearish > neutral + bullish) {
            return SentimentLabel.BEARISH;
        }
        return SentimentLabel.NEUTRAL;
    }

    /**
     * Snipe sentiment sub-score: share balance of bullish against bearish classifications.
     */
    public double snipeSentimentScore(List<SentimentClass> sentiments) {
        if (sentiments == null || sentiments.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        long bullish = sentiments.stream().filter(s -> s.label() == SentimentLabel.BULLISH).count();
        long bearish = sentiments.stream().filter(s -> s.label() == SentimentLabel.BEARISH).count();
        double bullishPct = 100.0 * bullish / sentiments.size();
        double bearishPct = 100.0 * bearish / sentiments.size();
        return ScoreMath.clampScore(1.5 * bullishPct - 1.5 * bearishPct + 50.0);
    }
}
