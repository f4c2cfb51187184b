package com.alphatransformer.backend.service;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.exception.StreamConnectionException;
import com.alphatransformer.backend.service.marketdata.KlineStreamIngestor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class MarketDataLifecycleTest {

    private MarketDataProperties properties;
    private HistoricalDataBootstrapper bootstrapper;
    private KlineStreamIngestor ingestor;
    private MarketDataLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        properties = new MarketDataProperties();
        properties.setSymbols(List.of("BTCUSDT"));
        properties.setTimeframes(List.of("1h"));
        bootstrapper = mock(HistoricalDataBootstrapper.class);
        ingestor = mock(KlineStreamIngestor.class);
        lifecycle = new MarketDataLifecycle(properties, bootstrapper, ingestor);
    }

    @Test
    void startBootstrapsConnectsSubscribesAndRunsLoop() {
        lifecycle.start();

        InOrder order = inOrder(bootstrapper, ingestor);
        order.verify(bootstrapper).initialize();
        order.verify(ingestor).connect();
        order.verify(ingestor).subscribeAll(List.of("BTCUSDT"), List.of("1h"));
        verify(ingestor, timeout(1_000)).runReceiveLoop();
        assertThat(lifecycle.isRunning()).isTrue();

        lifecycle.stop();

        verify(ingestor).disconnect();
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    void disabledStreamLeavesIngestorIdle() {
        properties.getStream().setEnabled(false);

        lifecycle.start();
        lifecycle.stop();

        verifyNoInteractions(bootstrapper, ingestor);
    }

    @Test
    void bootstrapCanBeSkipped() {
        properties.getBootstrap().setEnabled(false);

        lifecycle.start();
        lifecycle.stop();

        verify(bootstrapper, never()).initialize();
        verify(ingestor).connect();
    }

    @Test
    void failedInitialConnectAbortsStart() {
        doThrow(new StreamConnectionException("exchange down")).when(ingestor).connect();

        assertThatThrownBy(lifecycle::start)
                .isInstanceOf(StreamConnectionException.class)
                .hasMessage("exchange down");

        assertThat(lifecycle.isRunning()).isFalse();
        verify(ingestor, never()).subscribeAll(List.of("BTCUSDT"), List.of("1h"));
    }
}
