package com.alphatransformer.backend.service;

import com.alphatransformer.backend.event.StreamTerminatedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StreamTerminationListener {

    @EventListener(StreamTerminatedEvent.class)
    public void onStreamTerminated(StreamTerminatedEvent event) {
        log.error("Market stream terminated exchange={} attempts={} lastError={} occurredAt={}",
                event.exchange(), event.reconnectAttempts(), event.lastError(), event.occurredAt());
    }
}
