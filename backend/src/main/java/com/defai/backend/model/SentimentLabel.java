package com.defai.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SentimentLabel {
    BULLISH("bullish"),
    NEUTRAL("neutral"),
    BEARISH("bearish");

    private final String wireName;

    SentimentLabel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SentimentLabel fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Sentiment label is required");
        }
        return SentimentLabel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
