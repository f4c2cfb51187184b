package com.alphatransformer.backend.service;

import com.alphatransformer.backend.model.UpsertOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static com.alphatransformer.backend.util.TestKlineFactory.BASE_OPEN_TIME;
import static com.alphatransformer.backend.util.TestKlineFactory.kline;
import static org.assertj.core.api.Assertions.assertThat;

class KlineMetricsListenerTest {

    @Test
    void countsIngestedKlinesPerSeries() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        KlineMetricsListener listener = new KlineMetricsListener(registry);

        listener.onKline(kline("BTCUSDT", "1h", BASE_OPEN_TIME, 1, false), UpsertOutcome.APPENDED);
        listener.onKline(kline("BTCUSDT", "1h", BASE_OPEN_TIME, 2, false), UpsertOutcome.REPLACED);
        listener.onKline(kline("BTCUSDT", "1h", BASE_OPEN_TIME, 2, true), UpsertOutcome.REPLACED);

        assertThat(registry.get("market.klines.ingested")
                .tag("symbol", "BTCUSDT").tag("timeframe", "1h").tag("final", "false")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get("market.klines.ingested")
                .tag("final", "true")
                .counter().count()).isEqualTo(1.0);
    }
}
