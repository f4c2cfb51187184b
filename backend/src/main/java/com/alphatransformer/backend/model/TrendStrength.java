package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendStrength {
    STRONG("strong"),
    MODERATE("moderate"),
    WEAK("weak");

    private final String label;

    TrendStrength(String label) {
        this.label = label;
    }

    public static TrendStrength fromAdx(double adx) {
        if (adx > 25.0) {
            return STRONG;
        }
        if (adx < 20.0) {
            return WEAK;
        }
        return MODERATE;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
