package com.defai.backend.service.history;

public record ScoreStatistics(int count, double mean, double median, double std, double min, double max) {

    public static ScoreStatistics empty() {
        return new ScoreStatistics(0, 50.0, 50.0, 0.0, 50.0, 50.0);
    }
}
