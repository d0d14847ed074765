package com.defai.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete upside tier attached to a {@link SnipeSignal}, best first.
 */
public enum Prediction {
    X100("100x"),
    X10("10x"),
    X5("5x"),
    X2("2x"),
    HOLD("hold"),
    AVOID("avoid");

    private final String label;

    Prediction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static Prediction fromLabel(String label) {
        for (Prediction prediction : values()) {
            if (prediction.label.equalsIgnoreCase(label)) {
                return prediction;
            }
        }
        throw new IllegalArgumentException("Unknown prediction: " + label);
    }
}
