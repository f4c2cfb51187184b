package com.alphatransformer.backend.event;

import java.time.Instant;

public record StreamTerminatedEvent(
        String exchange,
        int reconnectAttempts,
        String lastError,
        Instant occurredAt
) {
}
