package com.alphatransformer.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("Startup aborted. Root cause: {}", root.getMessage(), exception);
        for (Throwable suppressed : root.getSuppressed()) {
            log.error("Suppressed during startup: {}", suppressed.getMessage(), suppressed);
        }
    }

    @Component
    @Slf4j
    public static class StartupReadyListener implements ApplicationListener<ApplicationReadyEvent> {

        private final MarketDataProperties properties;

        public StartupReadyListener(MarketDataProperties properties) {
            this.properties = properties;
        }

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            log.info("Market data backend ready exchange={} symbols={} timeframes={} streamEnabled={}",
                    properties.getExchange(), properties.getSymbols(), properties.getTimeframes(),
                    properties.getStream().isEnabled());
        }
    }

    static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
