package com.defai.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Two-half trend over a flat batch of scores.
 */
public enum AggregateTrend {
    BULLISH("bullish"),
    NEUTRAL("neutral"),
    BEARISH("bearish");

    private final String wireName;

    AggregateTrend(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
