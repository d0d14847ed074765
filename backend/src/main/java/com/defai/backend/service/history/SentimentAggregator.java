package com.defai.backend.service.history;

import com.defai.backend.model.AggregateTrend;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Batch statistics over flat score lists, independent of any token history.
 */
@Component
public class SentimentAggregator {

    public ScoreStatistics aggregate(List<Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return ScoreStatistics.empty();
        }
        double[] sorted = sortedCopy(scores);
        int n = sorted.length;
        double mean = Arrays.stream(sorted).average().orElse(50.0);
        double median = n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
        double std = 0.0;
        if (n > 1) {
            double squares = Arrays.stream(sorted).map(v -> (v - mean) * (v - mean)).sum();
            std = Math.sqrt(squares / (n - 1));
        }
        return new ScoreStatistics(n, mean, median, std, sorted[0], sorted[n - 1]);
    }

    /**
     * Indices into {@code scores} of values outside the 1.5 IQR fences.
     */
    public List<Integer> detectOutliers(List<Double> scores) {
        if (scores == null || scores.size() < 4) {
            return List.of();
        }
        double[] sorted = sortedCopy(scores);
        int n = sorted.length;
        double q1 = sorted[n / 4];
        double q3 = sorted[3 * n / 4];
        double iqr = q3 - q1;
        double lower = q1 - 1.5 * iqr;
        double upper = q3 + 1.5 * iqr;
        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < scores.size(); i++) {
            double value = scores.get(i);
            if (value < lower || value > upper) {
                outliers.add(i);
            }
        }
        return outliers;
    }

    public AggregateTrend trend(List<Double> scores) {
        if (scores == null || scores.size() < 2) {
            return AggregateTrend.NEUTRAL;
        }
        int mid = scores.size() / 2;
        double firstHalf = scores.subList(0, mid).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double secondHalf = scores.subList(mid, scores.size()).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (secondHalf > firstHalf * 1.1) {
            return AggregateTrend.BULLISH;
        }
        if (secondHalf < firstHalf * 0.9) {
            return AggregateTrend.BEARISH;
        }
        return AggregateTrend.NEUTRAL;
    }

    private double[] sortedCopy(List<Double> scores) {
        double[] values = scores.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(values);
        return values;
    }
}
