package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.dto.StreamStatus;
import com.alphatransformer.backend.event.StreamTerminatedEvent;
import com.alphatransformer.backend.exception.StreamConnectionException;
import com.alphatransformer.backend.model.ConnectionState;
import com.alphatransformer.backend.model.UpsertOutcome;
import com.alphatransformer.backend.service.KlineCache;
import com.alphatransformer.backend.service.marketdata.FakeKlineStreamConnector.FakeConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class KlineStreamIngestorTest {

    private MarketDataProperties properties;
    private KlineCache cache;
    private ApplicationEventPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private FakeKlineStreamConnector connector;

    @BeforeEach
    void setUp() {
        properties = new MarketDataProperties();
        properties.getStream().setUrl("ws://fake/stream");
        properties.getStream().setMaxReconnectAttempts(3);
        properties.getStream().setReconnectDelayMs(5);
        properties.getStream().setSubscribeDelayMs(0);
        cache = new KlineCache(100);
        publisher = mock(ApplicationEventPublisher.class);
        meterRegistry = new SimpleMeterRegistry();
        connector = new FakeKlineStreamConnector();
    }

    private KlineStreamIngestor ingestor(KlineListener... listeners) {
        return new KlineStreamIngestor(connector, cache, new KlineFrameParser(new ObjectMapper()), properties,
                publisher, List.of(listeners), meterRegistry, Clock.systemUTC());
    }

    @Test
    void connectMarksConnected() {
        connector.then(new FakeConnection());
        KlineStreamIngestor ingestor = ingestor();

        ingestor.connect();

        StreamStatus status = ingestor.status();
        assertThat(status.state()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(status.connected()).isTrue();
        assertThat(status.reconnectCount()).isZero();
        assertThat(status.lastMessageTime()).isNotNull();
        assertThat(meterRegistry.get("market.stream.state").gauge().value())
                .isEqualTo(ConnectionState.CONNECTED.ordinal());
    }

    @Test
    void failedConnectThrowsAndStaysDisconnected() {
        KlineStreamIngestor ingestor = ingestor();

        assertThatThrownBy(ingestor::connect).isInstanceOf(StreamConnectionException.class);

        assertThat(ingestor.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(ingestor.status().lastError()).contains("connection refused");
    }

    @Test
    void subscribesOneFramePerSymbol() {
        FakeConnection connection = new FakeConnection();
        connector.then(connection);
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();

        ingestor.subscribeAll(List.of("BTCUSDT", "ETHUSDT"), List.of("3m", "1h"));

        assertThat(connection.sent).hasSize(2);
        assertThat(connection.sent.get(0)).contains("btcusdt@kline_3m", "btcusdt@kline_1h", "SUBSCRIBE");
        assertThat(connection.sent.get(1)).contains("ethusdt@kline_3m", "ethusdt@kline_1h");
        assertThat(ingestor.status().subscriptions()).containsOnlyKeys("BTCUSDT", "ETHUSDT");
    }

    @Test
    void failedSubscriptionDoesNotStopTheRest() {
        FakeConnection connection = new FakeConnection().failSendWhen(frame -> frame.contains("btcusdt"));
        connector.then(connection);
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();

        ingestor.subscribeAll(List.of("BTCUSDT", "ETHUSDT"), List.of("1h"));

        assertThat(connection.sent).singleElement().asString().contains("ethusdt@kline_1h");
    }

    @Test
    void ingestsKlinesSkipsMalformedAndIsolatesListeners() throws Exception {
        FakeConnection connection = new FakeConnection().deliver(
                "{not json",
                "{\"result\":null,\"id\":1}",
                frame(1700000000000L, "100.0", false),
                "{\"ping\":true}",
                frame(1700000000000L, "101.0", true));
        connector.then(connection);
        List<String> calls = new CopyOnWriteArrayList<>();
        KlineStreamIngestor ingestor = ingestor(
                (kline, outcome) -> calls.add("first:" + outcome),
                (kline, outcome) -> {
                    throw new IllegalStateException("listener boom");
                },
                (kline, outcome) -> calls.add("third:" + outcome));
        ingestor.connect();

        Thread loop = startLoop(ingestor);
        awaitCondition(() -> calls.size() == 4);
        ingestor.disconnect();
        loop.join(2_000);

        assertThat(loop.isAlive()).isFalse();
        assertThat(calls).containsExactly(
                "first:" + UpsertOutcome.APPENDED, "third:" + UpsertOutcome.APPENDED,
                "first:" + UpsertOutcome.REPLACED, "third:" + UpsertOutcome.REPLACED);
        assertThat(ingestor.malformedFrameCount()).isEqualTo(2);
        assertThat(cache.getLatest("BTCUSDT", "1h").orElseThrow().getClose()).isEqualTo(101.0);
        assertThat(ingestor.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void rejectedUpdatesDoNotReachListeners() throws Exception {
        FakeConnection connection = new FakeConnection().deliver(
                frame(1700000000000L, "100.0", true),
                frame(1700000000000L, "99.0", false),
                frame(1700003600000L, "102.0", false));
        connector.then(connection);
        List<String> calls = new CopyOnWriteArrayList<>();
        KlineStreamIngestor ingestor = ingestor((kline, outcome) -> calls.add(kline.getClose() + ":" + outcome));
        ingestor.connect();

        Thread loop = startLoop(ingestor);
        awaitCondition(() -> calls.size() == 2);
        ingestor.disconnect();
        loop.join(2_000);

        assertThat(calls).containsExactly("100.0:APPENDED", "102.0:APPENDED");
    }

    @Test
    void givesUpAfterMaxReconnectAttempts() throws Exception {
        FakeConnection first = new FakeConnection();
        connector.then(first);
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();
        first.close();

        Thread loop = startLoop(ingestor);
        loop.join(5_000);

        assertThat(loop.isAlive()).isFalse();
        assertThat(connector.connectCalls()).isEqualTo(4);
        assertThat(ingestor.state()).isEqualTo(ConnectionState.TERMINALLY_FAILED);
        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(publisher).publishEvent(event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(StreamTerminatedEvent.class, terminated -> {
            assertThat(terminated.reconnectAttempts()).isEqualTo(3);
            assertThat(terminated.exchange()).isEqualTo("binance");
            assertThat(terminated.lastError()).contains("connection refused");
        });

        ingestor.disconnect();
        assertThat(ingestor.state()).isEqualTo(ConnectionState.TERMINALLY_FAILED);
    }

    @Test
    void reconnectResubscribesAndResumes() throws Exception {
        FakeConnection first = new FakeConnection();
        FakeConnection second = new FakeConnection().deliver(frame(1700000000000L, "105.0", false));
        connector.then(first).then(second);
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();
        ingestor.subscribeAll(List.of("BTCUSDT"), List.of("1h", "4h"));
        first.close();

        Thread loop = startLoop(ingestor);
        awaitCondition(() -> cache.getLatest("BTCUSDT", "1h").isPresent());
        ingestor.disconnect();
        loop.join(2_000);

        assertThat(connector.connectCalls()).isEqualTo(2);
        assertThat(second.sent).singleElement().asString().contains("btcusdt@kline_1h", "btcusdt@kline_4h");
        assertThat(ingestor.status().reconnectCount()).isZero();
        assertThat(second.isClosed()).isTrue();
        verify(publisher, never()).publishEvent(any(StreamTerminatedEvent.class));
    }

    @Test
    void disconnectUnblocksPendingReceive() throws Exception {
        connector.then(new FakeConnection());
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();

        Thread loop = startLoop(ingestor);
        Thread.sleep(50);
        ingestor.disconnect();
        loop.join(2_000);

        assertThat(loop.isAlive()).isFalse();
        assertThat(connector.connectCalls()).isEqualTo(1);
        assertThat(ingestor.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void disconnectInterruptsReconnectDelay() throws Exception {
        properties.getStream().setReconnectDelayMs(60_000);
        FakeConnection first = new FakeConnection();
        connector.then(first);
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();
        first.close();

        Thread loop = startLoop(ingestor);
        awaitCondition(() -> ingestor.state() == ConnectionState.RECONNECTING);
        ingestor.disconnect();
        loop.join(2_000);

        assertThat(loop.isAlive()).isFalse();
        assertThat(connector.connectCalls()).isEqualTo(1);
        assertThat(ingestor.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void interruptedLoopClosesStreamAndReportsDisconnected() throws Exception {
        FakeConnection connection = new FakeConnection();
        connector.then(connection);
        KlineStreamIngestor ingestor = ingestor();
        ingestor.connect();

        Thread loop = startLoop(ingestor);
        loop.interrupt();
        loop.join(2_000);

        assertThat(loop.isAlive()).isFalse();
        assertThat(connection.isClosed()).isTrue();
        assertThat(ingestor.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(ingestor.status().connected()).isFalse();
        assertThat(connector.connectCalls()).isEqualTo(1);
    }

    static String frame(long openTime, String close, boolean isFinal) {
        return "{\"stream\":\"btcusdt@kline_1h\",\"data\":{\"e\":\"kline\",\"s\":\"BTCUSDT\",\"k\":{"
                + "\"t\":" + openTime + ",\"T\":" + (openTime + 3_599_999) + ",\"i\":\"1h\","
                + "\"o\":\"100.0\",\"h\":\"110.0\",\"l\":\"90.0\",\"c\":\"" + close + "\","
                + "\"v\":\"10\",\"q\":\"1000\",\"n\":5,\"V\":\"4\",\"Q\":\"400\",\"x\":" + isFinal + "}}}";
    }

    private static Thread startLoop(KlineStreamIngestor ingestor) {
        Thread thread = new Thread(ingestor::runReceiveLoop, "test-kline-ingestor");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
