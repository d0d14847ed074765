package com.defai.backend.service.scoring;

final class ScoreMath {

    private ScoreMath() {
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }

    static double clampScore(double value) {
        return clamp(value, 0.0, 100.0);
    }
}
