package com.alphatransformer.backend.service;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.service.marketdata.KlineStreamIngestor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Bootstrap, connect, subscribe, then run the receive loop on its own thread.
 * A failed first connect propagates and aborts application startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketDataLifecycle implements SmartLifecycle {

    private static final long STOP_JOIN_MS = 5_000;

    private final MarketDataProperties properties;
    private final HistoricalDataBootstrapper bootstrapper;
    private final KlineStreamIngestor ingestor;

    private volatile boolean running;
    private Thread receiveThread;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!properties.getStream().isEnabled()) {
            log.info("Kline stream disabled via config");
            running = true;
            return;
        }
        if (properties.getBootstrap().isEnabled()) {
            bootstrapper.initialize();
        }
        ingestor.connect();
        ingestor.subscribeAll(properties.getSymbols(), properties.getTimeframes());
        receiveThread = new Thread(ingestor::runReceiveLoop, "kline-ingestor");
        receiveThread.setDaemon(true);
        receiveThread.start();
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (receiveThread == null) {
            return;
        }
        ingestor.disconnect();
        try {
            receiveThread.join(STOP_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (receiveThread.isAlive()) {
            log.warn("Kline receive thread did not stop within {} ms", STOP_JOIN_MS);
        }
        receiveThread = null;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
