package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.dto.StreamStatus;
import com.alphatransformer.backend.event.StreamTerminatedEvent;
import com.alphatransformer.backend.exception.MalformedFrameException;
import com.alphatransformer.backend.exception.StreamConnectionException;
import com.alphatransformer.backend.model.ConnectionState;
import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.model.UpsertOutcome;
import com.alphatransformer.backend.service.KlineCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single kline stream connection and is the only stream writer of the {@link KlineCache}.
 * <p>
 * {@link #runReceiveLoop()} blocks the calling thread until {@link #disconnect()} is called or the
 * reconnect budget is spent. Lost connections are reopened with a fixed delay; every open resets the
 * attempt counter, so the budget bounds consecutive failures.
 */
@Slf4j
@Service
public class KlineStreamIngestor {

    private final KlineStreamConnector connector;
    private final KlineCache klineCache;
    private final KlineFrameParser frameParser;
    private final MarketDataProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final List<KlineListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, List<String>> subscriptions = new LinkedHashMap<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicInteger reconnectCount = new AtomicInteger();
    private final AtomicInteger requestId = new AtomicInteger();
    private final AtomicLong malformedFrames = new AtomicLong();
    private final Object reconnectMonitor = new Object();

    private volatile KlineStreamConnection connection;
    private volatile boolean stopRequested;
    private volatile Instant lastMessageTime;
    private volatile String lastError;

    public KlineStreamIngestor(KlineStreamConnector connector,
                               KlineCache klineCache,
                               KlineFrameParser frameParser,
                               MarketDataProperties properties,
                               ApplicationEventPublisher eventPublisher,
                               List<KlineListener> klineListeners,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.connector = connector;
        this.klineCache = klineCache;
        this.frameParser = frameParser;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.listeners.addAll(klineListeners);
        Gauge.builder("market.stream.state", state, s -> s.get().ordinal())
                .description("Kline stream connection state ordinal")
                .register(meterRegistry);
        Gauge.builder("market.stream.reconnect.count", reconnectCount, AtomicInteger::get)
                .description("Consecutive reconnect attempts")
                .register(meterRegistry);
    }

    public void addListener(KlineListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    public void connect() {
        stopRequested = false;
        state.set(ConnectionState.CONNECTING);
        try {
            openConnection();
        } catch (StreamConnectionException e) {
            state.set(ConnectionState.DISCONNECTED);
            throw e;
        }
    }

    /**
     * Sends one SUBSCRIBE frame per symbol covering all timeframes. The pairs are remembered and
     * replayed after every reconnect.
     */
    public void subscribeAll(List<String> symbols, List<String> timeframes) {
        synchronized (subscriptions) {
            for (String symbol : symbols) {
                subscriptions.put(symbol.toUpperCase(Locale.ROOT), List.copyOf(timeframes));
            }
        }
        sendSubscriptions();
    }

    public void runReceiveLoop() {
        log.info("Kline receive loop started on {}", Thread.currentThread().getName());
        while (!stopRequested) {
            KlineStreamConnection current = connection;
            if (current == null || !state.get().isReceiving()) {
                break;
            }
            try {
                String raw = current.receive();
                lastMessageTime = clock.instant();
                handleFrame(raw);
            } catch (StreamConnectionException e) {
                if (stopRequested) {
                    break;
                }
                lastError = e.getMessage();
                log.warn("Kline stream lost: {}", e.getMessage());
                if (!reconnect()) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            KlineStreamConnection current = connection;
            if (current != null) {
                closeQuietly(current);
            }
            log.warn("Kline receive loop interrupted, closing stream");
        }
        if (stopRequested || Thread.currentThread().isInterrupted()) {
            state.updateAndGet(s -> s == ConnectionState.TERMINALLY_FAILED ? s : ConnectionState.DISCONNECTED);
        }
        log.info("Kline receive loop stopped state={}", state.get());
    }

    /**
     * Safe to call while another thread is blocked in {@link #runReceiveLoop()}: closing the
     * transport unblocks the pending receive.
     */
    public void disconnect() {
        stopRequested = true;
        synchronized (reconnectMonitor) {
            reconnectMonitor.notifyAll();
        }
        KlineStreamConnection current = connection;
        if (current != null) {
            closeQuietly(current);
        }
        ConnectionState previous = state.getAndUpdate(
                s -> s == ConnectionState.TERMINALLY_FAILED ? s : ConnectionState.DISCONNECTED);
        log.info("Kline stream disconnected (was {})", previous);
    }

    public StreamStatus status() {
        Map<String, List<String>> subscribed;
        synchronized (subscriptions) {
            subscribed = new LinkedHashMap<>(subscriptions);
        }
        ConnectionState current = state.get();
        return new StreamStatus(
                properties.getExchange(),
                current,
                current == ConnectionState.CONNECTED,
                reconnectCount.get(),
                lastMessageTime,
                lastError,
                subscribed
        );
    }

    public ConnectionState state() {
        return state.get();
    }

    long malformedFrameCount() {
        return malformedFrames.get();
    }

    void handleFrame(String raw) {
        KlineFrame frame;
        try {
            frame = frameParser.parse(raw);
        } catch (MalformedFrameException e) {
            malformedFrames.incrementAndGet();
            log.warn("Dropping malformed frame: {}", e.getMessage());
            return;
        }
        switch (frame.type()) {
            case KLINE -> ingest(frame.kline());
            case SUBSCRIPTION_ACK -> log.debug("Subscription acknowledged: {}", frame.detail());
            case ERROR -> log.warn("Exchange reported error: {}", frame.detail());
        }
    }

    private void ingest(Kline kline) {
        UpsertOutcome outcome = klineCache.upsert(kline);
        if (!outcome.isAccepted()) {
            return;
        }
        for (KlineListener listener : listeners) {
            try {
                listener.onKline(kline, outcome);
            } catch (RuntimeException e) {
                log.warn("Kline listener {} failed for {} {}: {}", listener.getClass().getSimpleName(),
                        kline.getSymbol(), kline.getTimeframe(), e.getMessage(), e);
            }
        }
    }

    private void openConnection() {
        String url = properties.getStream().getUrl();
        try {
            KlineStreamConnection opened = connector.connect(url);
            connection = opened;
            reconnectCount.set(0);
            lastMessageTime = clock.instant();
            state.set(ConnectionState.CONNECTED);
            log.info("Kline stream connected exchange={} url={}", properties.getExchange(), url);
        } catch (StreamConnectionException e) {
            lastError = e.getMessage();
            log.error("Kline stream connect failed url={}: {}", url, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Kline stream connect failed url={}: {}", url, e.getMessage());
            throw new StreamConnectionException("Unable to connect to " + url, e);
        }
    }

    private boolean reconnect() {
        MarketDataProperties.Stream config = properties.getStream();
        while (!stopRequested) {
            state.set(ConnectionState.RECONNECTING);
            int attempt = reconnectCount.incrementAndGet();
            if (attempt > config.getMaxReconnectAttempts()) {
                terminate(attempt - 1);
                return false;
            }
            KlineStreamConnection stale = connection;
            if (stale != null) {
                closeQuietly(stale);
            }
            log.info("Reconnecting kline stream attempt {}/{} in {} ms",
                    attempt, config.getMaxReconnectAttempts(), config.getReconnectDelayMs());
            if (!awaitReconnectDelay(config.getReconnectDelayMs())) {
                return false;
            }
            try {
                openConnection();
            } catch (StreamConnectionException e) {
                continue;
            }
            if (stopRequested) {
                closeQuietly(connection);
                return false;
            }
            sendSubscriptions();
            return true;
        }
        return false;
    }

    private void terminate(int attempts) {
        state.set(ConnectionState.TERMINALLY_FAILED);
        log.error("Kline stream gave up after {} reconnect attempts, last error: {}", attempts, lastError);
        eventPublisher.publishEvent(new StreamTerminatedEvent(
                properties.getExchange(), attempts, lastError, clock.instant()));
    }

    private boolean awaitReconnectDelay(long delayMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
        synchronized (reconnectMonitor) {
            while (!stopRequested) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    return true;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(reconnectMonitor, remainingNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return false;
    }

    private void sendSubscriptions() {
        List<Map.Entry<String, List<String>>> pending;
        synchronized (subscriptions) {
            pending = new ArrayList<>(subscriptions.entrySet());
        }
        KlineStreamConnection current = connection;
        if (current == null) {
            log.warn("Not connected, {} subscriptions deferred until the next connect", pending.size());
            return;
        }
        long delayMs = properties.getStream().getSubscribeDelayMs();
        for (int i = 0; i < pending.size(); i++) {
            if (i > 0 && delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Subscription batching interrupted after {} symbols", i);
                    return;
                }
            }
            String symbol = pending.get(i).getKey();
            List<String> streams = pending.get(i).getValue().stream()
                    .map(tf -> KlineFrameParser.streamName(symbol, tf))
                    .toList();
            try {
                if (current.send(frameParser.subscribeFrame(streams, requestId.incrementAndGet()))) {
                    log.info("Subscribed {} -> {}", symbol, streams);
                } else {
                    log.warn("Subscribe frame for {} was not sent", symbol);
                }
            } catch (RuntimeException e) {
                log.warn("Subscribe failed for {}: {}", symbol, e.getMessage());
            }
        }
    }

    private void closeQuietly(KlineStreamConnection target) {
        try {
            target.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring error while closing kline stream: {}", e.getMessage());
        }
    }
}
