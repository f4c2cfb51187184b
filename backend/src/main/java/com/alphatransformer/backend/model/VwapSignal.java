package com.alphatransformer.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VwapSignal {
    ABOVE("above"),
    BELOW("below");

    private final String label;

    VwapSignal(String label) {
        this.label = label;
    }

    public static VwapSignal fromRatio(double vwapRatio) {
        return vwapRatio > 0 ? ABOVE : BELOW;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
