package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MarketRegime {
    STRONG_TREND("strong_trend"),
    MODERATE_TREND("moderate_trend"),
    RANGING("ranging");

    private final String label;

    MarketRegime(String label) {
        this.label = label;
    }

    public static MarketRegime fromAverageAdx(double averageAdx) {
        if (averageAdx > 25.0) {
            return STRONG_TREND;
        }
        if (averageAdx < 20.0) {
            return RANGING;
        }
        return MODERATE_TREND;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
