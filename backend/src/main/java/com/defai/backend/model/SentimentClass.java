package com.defai.backend.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Classifier output for a single text unit.
 */
public record SentimentClass(SentimentLabel label, double confidence, Map<SentimentLabel, Double> probabilities) {

    private static final double PROBABILITY_TOLERANCE = 0.01;

    public SentimentClass {
        if (label == null) {
            throw new IllegalArgumentException("Sentiment label is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
        if (probabilities == null || probabilities.isEmpty()) {
            probabilities = Map.of(label, 1.0);
        }
        double sum = 0.0;
        for (Map.Entry<SentimentLabel, Double> entry : probabilities.entrySet()) {
            Double p = entry.getValue();
            if (p == null || p.isNaN() || p < 0.0 || p > 1.0) {
                throw new IllegalArgumentException("Probability for " + entry.getKey().wireName() + " out of range: " + p);
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > PROBABILITY_TOLERANCE) {
            throw new IllegalArgumentException("Probabilities must sum to 1, got " + sum);
        }
        probabilities = Map.copyOf(new EnumMap<>(probabilities));
    }

    public static SentimentClass of(SentimentLabel label, double confidence) {
        return new SentimentClass(label, confidence, Map.of(label, 1.0));
    }

    /**
     * Result used when the classifier fails or has nothing to work with.
     */
    public static SentimentClass neutralFallback() {
        return new SentimentClass(SentimentLabel.NEUTRAL, 0.0, Map.of(
                SentimentLabel.BULLISH, 0.33,
                SentimentLabel.NEUTRAL, 0.34,
                SentimentLabel.BEARISH, 0.33));
    }
}
