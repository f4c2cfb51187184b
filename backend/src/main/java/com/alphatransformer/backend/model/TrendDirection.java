package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    UP("up"),
    DOWN("down"),
    CHOPPY("choppy");

    private final String label;

    TrendDirection(String label) {
        this.label = label;
    }

    /**
     * Classifies the share of timeframes whose fast EMA sits above the slow EMA.
     * Both boundaries (0.6 and 0.4) are choppy.
     */
    public static TrendDirection fromConsistency(double consistency) {
        if (consistency > 0.6) {
            return UP;
        }
        if (consistency < 0.4) {
            return DOWN;
        }
        return CHOPPY;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
