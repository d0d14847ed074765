package com.defai.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of a token's sentiment over a lookback window of its history.
 */
public enum TrendDirection {
    RISING("rising"),
    FALLING("falling"),
    STABLE("stable"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String wireName;

    TrendDirection(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TrendDirection fromWire(String value) {
        return TrendDirection.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
