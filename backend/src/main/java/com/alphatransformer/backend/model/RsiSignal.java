package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RsiSignal {
    OVERBOUGHT("overbought"),
    OVERSOLD("oversold"),
    NEUTRAL("neutral");

    private final String label;

    RsiSignal(String label) {
        this.label = label;
    }

    public static RsiSignal fromRsi(double rsi) {
        if (rsi > 70.0) {
            return OVERBOUGHT;
        }
        if (rsi < 30.0) {
            return OVERSOLD;
        }
        return NEUTRAL;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
