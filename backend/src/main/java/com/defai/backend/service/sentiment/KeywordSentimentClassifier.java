package com.defai.backend.service.sentiment;

import com.defai.backend.model.SentimentClass;
import com.defai.backend.model.SentimentLabel;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexicon classifier used when no model is wired in. Counts bullish and bearish keyword hits
 * and maps the balance to a label and confidence.
 */
@Component
public class KeywordSentimentClassifier implements SentimentClassifier {

    static final List<String> BULLISH_WORDS = List.of("moon", "rocket", "gem", "diamond", "hodl", "lambo",
            "pump", "bullish", "buy", "breakout");
    static final List<String> BEARISH_WORDS = List.of("rug", "scam", "dump", "dead", "collapse", "bankrupt",
            "bearish", "sell", "rekt", "crash");

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^a-z0-9]+");

    @Override
    public SentimentClass classify(String text) {
        if (text == null || text.isBlank()) {
            return SentimentClass.neutralFallback();
        }
        int bullish = 0;
        int bearish = 0;
        for (String word : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (word.isEmpty()) {
                continue;
            }
            if (matches(BULLISH_WORDS, word)) {
                bullish++;
            } else if (matches(BEARISH_WORDS, word)) {
                bearish++;
            }
        }
        int hits = bullish + bearish;
        if (hits == 0) {
            return distribution(SentimentLabel.NEUTRAL, 0.6, 0.2, 0.6, 0.2);
        }
        double bullShare = (double) bullish / hits;
        double strength = Math.min(1.0, 0.5 + 0.1 * hits);
        if (bullish > bearish) {
            double confidence = round(strength * bullShare);
            return distribution(SentimentLabel.BULLISH, confidence, confidence, (1 - confidence) / 2, (1 - confidence) / 2);
        }
        if (bearish > bullish) {
            double confidence = round(strength * (1 - bullShare));
            return distribution(SentimentLabel.BEARISH, confidence, (1 - confidence) / 2, (1 - confidence) / 2, confidence);
        }
        return distribution(SentimentLabel.NEUTRAL, 0.5, 0.25, 0.5, 0.25);
    }

    private boolean matches(List<String> lexicon, String word) {
        for (String entry : lexicon) {
            if (word.equals(entry) || (word.startsWith(entry) && word.length() <= entry.length() + 2)) {
                return true;
            }
        }
        return false;
    }

    private SentimentClass distribution(SentimentLabel label, double confidence,
                                        double bullish, double neutral, double bearish) {
        Map<SentimentLabel, Double> probabilities = new EnumMap<>(SentimentLabel.class);
        probabilities.put(SentimentLabel.BULLISH, bullish);
        probabilities.put(SentimentLabel.NEUTRAL, neutral);
        probabilities.put(SentimentLabel.BEARISH, bearish);
        return new SentimentClass(label, confidence, probabilities);
    }

    private double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
