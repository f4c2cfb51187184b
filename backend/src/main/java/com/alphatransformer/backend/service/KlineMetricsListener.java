package com.alphatransformer.backend.service;

import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.model.UpsertOutcome;
import com.alphatransformer.backend.service.marketdata.KlineListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class KlineMetricsListener implements KlineListener {

    private final MeterRegistry meterRegistry;

    @Override
    public void onKline(Kline kline, UpsertOutcome outcome) {
        Counter.builder("market.klines.ingested")
                .tag("symbol", kline.getSymbol())
                .tag("timeframe", kline.getTimeframe())
                .tag("final", Boolean.toString(kline.isFinal()))
                .register(meterRegistry)
                .increment();
    }
}
