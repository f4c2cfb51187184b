package com.alphatransformer.backend.model;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    TERMINALLY_FAILED;

    public boolean isReceiving() {
        return this == CONNECTED || this == RECONNECTING;
    }
}
