package com.alphatransformer.backend.service;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.service.marketdata.HistoricalKlineClient;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.alphatransformer.backend.util.TestKlineFactory.BASE_OPEN_TIME;
import static com.alphatransformer.backend.util.TestKlineFactory.MINUTE;
import static com.alphatransformer.backend.util.TestKlineFactory.kline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HistoricalDataBootstrapperTest {

    @Test
    void loadsEveryConfiguredPair() {
        MarketDataProperties properties = new MarketDataProperties();
        properties.setSymbols(List.of("BTCUSDT", "ETHUSDT"));
        properties.setTimeframes(List.of("1h", "4h"));
        properties.getRest().setHistoryLimit(50);
        HistoricalKlineClient client = mock(HistoricalKlineClient.class);
        when(client.fetchKlines(anyString(), anyString(), anyInt())).thenReturn(List.of());
        when(client.fetchKlines("BTCUSDT", "1h", 50)).thenReturn(List.of(
                kline("BTCUSDT", "1h", BASE_OPEN_TIME, 1, true),
                kline("BTCUSDT", "1h", BASE_OPEN_TIME + MINUTE, 2, false)));
        when(client.fetchKlines("ETHUSDT", "4h", 50)).thenReturn(List.of(
                kline("ETHUSDT", "4h", BASE_OPEN_TIME, 3, true)));
        KlineCache cache = new KlineCache(100);

        int loaded = new HistoricalDataBootstrapper(client, cache, properties).initialize();

        assertThat(loaded).isEqualTo(3);
        assertThat(cache.get("BTCUSDT", "1h", null)).extracting(Kline::getClose).containsExactly(1.0, 2.0);
        assertThat(cache.get("ETHUSDT", "4h", null)).hasSize(1);
        assertThat(cache.get("BTCUSDT", "4h", null)).isEmpty();
        verify(client).fetchKlines(eq("ETHUSDT"), eq("1h"), eq(50));
    }

    @Test
    void liveUpdateReplacesBootstrappedOpenCandle() {
        MarketDataProperties properties = new MarketDataProperties();
        properties.setSymbols(List.of("BTCUSDT"));
        properties.setTimeframes(List.of("1h"));
        HistoricalKlineClient client = mock(HistoricalKlineClient.class);
        when(client.fetchKlines(anyString(), anyString(), anyInt())).thenReturn(List.of(
                kline("BTCUSDT", "1h", BASE_OPEN_TIME, 1, false)));
        KlineCache cache = new KlineCache(100);
        new HistoricalDataBootstrapper(client, cache, properties).initialize();

        cache.upsert(kline("BTCUSDT", "1h", BASE_OPEN_TIME, 1.5, false));

        assertThat(cache.getLatest("BTCUSDT", "1h").orElseThrow().getClose()).isEqualTo(1.5);
    }
}
