package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BandSignal {
    OVERBOUGHT("overbought"),
    OVERSOLD("oversold"),
    NORMAL("normal");

    private final String label;

    BandSignal(String label) {
        this.label = label;
    }

    public static BandSignal fromPosition(double position) {
        if (position > 0.8) {
            return OVERBOUGHT;
        }
        if (position < 0.2) {
            return OVERSOLD;
        }
        return NORMAL;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
