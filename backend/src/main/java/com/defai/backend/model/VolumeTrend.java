package com.defai.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VolumeTrend {
    INCREASING("increasing"),
    STABLE("stable"),
    DECREASING("decreasing");

    private final String wireName;

    VolumeTrend(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
