package com.defai.backend.dto;

import com.defai.backend.model.AggregateTrend;
import com.defai.backend.service.history.ScoreStatistics;

import java.util.List;

public record ScoreStatsResponse(ScoreStatistics stats, List<Integer> outliers, AggregateTrend trend) {
}
