package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MomentumBias {
    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral");

    private final String label;

    MomentumBias(String label) {
        this.label = label;
    }

    public static MomentumBias fromSlope(double slope) {
        if (slope > 0) {
            return BULLISH;
        }
        if (slope < 0) {
            return BEARISH;
        }
        return NEUTRAL;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
