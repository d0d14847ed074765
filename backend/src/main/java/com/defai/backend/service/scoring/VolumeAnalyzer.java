package com.defai.backend.service.scoring;

import com.defai.backend.model.VolumeAnalysis;
import com.defai.backend.model.VolumeMetrics;
import com.defai.backend.model.VolumeTrend;
import org.springframework.stereotype.Component;

@Component
public class VolumeAnalyzer {

    static final double HIGH_VOLUME_5M = 10_000;
    static final double MEDIUM_VOLUME_5M = 5_000;

    public VolumeAnalysis analyze(VolumeMetrics metrics) {
        double buyPressure = buyPressure(metrics.volume5m(), metrics.volume1h(), metrics.priceChange5m());
        return new VolumeAnalysis(buyPressure, 100.0 - buyPressure, volumeTrend(metrics.volume5m(), metrics.volume1h()));
    }

    public double buyPressure(double volume5m, double volume1h, double priceChange5m) {
        double acceleration = volume1h > 0 ? Math.min(100.0, 100.0 * volume5m / volume1h) : 0.0;
        double priceScore = ScoreMath.clamp(priceChange5m + 50.0, 0.0, 100.0);
        return ScoreMath.clampScore(0.6 * acceleration + 0.4 * priceScore);
    }

    public VolumeTrend volumeTrend(double volume5m, double volume1h) {
        if (volume5m <= 0 || volume1h <= 0) {
            return VolumeTrend.STABLE;
        }
        double ratio = volume5m / volume1h;
        if (ratio > 1.5) {
            return VolumeTrend.INCREASING;
        }
        if (ratio < 0.5) {
            return VolumeTrend.DECREASING;
        }
        return VolumeTrend.STABLE;
    }

    public double volumeScore(VolumeMetrics metrics, VolumeAnalysis analysis) {
        double score = 0.0;
        if (metrics.volume5m() > HIGH_VOLUME_5M) {
            score += 30;
        } else if (metrics.volume5m() > MEDIUM_VOLUME_5M) {
            score += 20;
        }
        if (analysis.volumeTrend() == VolumeTrend.INCREASING) {
            score += 30;
        } else if (analysis.volumeTrend() == VolumeTrend.STABLE) {
            score += 15;
        }
        score += analysis.buyPressure() / 100.0 * 40.0;
        return ScoreMath.clampScore(score);
    }
}
