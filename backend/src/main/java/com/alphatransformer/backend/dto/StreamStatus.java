package com.alphatransformer.backend.dto;

import com.alphatransformer.backend.model.ConnectionState;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StreamStatus(
        String exchange,
        ConnectionState state,
        boolean connected,
        int reconnectCount,
        Instant lastMessageTime,
        String lastError,
        Map<String, List<String>> subscriptions
) {}
