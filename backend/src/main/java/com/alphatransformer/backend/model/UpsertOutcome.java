package com.alphatransformer.backend.model;

public enum UpsertOutcome {
    APPENDED,
    REPLACED,
    REJECTED;

    public boolean isAccepted() {
        return this != REJECTED;
    }
}
