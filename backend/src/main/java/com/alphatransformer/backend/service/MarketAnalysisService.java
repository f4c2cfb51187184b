package com.alphatransformer.backend.service;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.dto.ConsensusSignal;
import com.alphatransformer.backend.dto.IndicatorSnapshot;
import com.alphatransformer.backend.dto.MultiTimeframeAnalysis;
import com.alphatransformer.backend.model.Kline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketAnalysisService {

    private final KlineCache klineCache;
    private final IndicatorEngine indicatorEngine;
    private final SignalAggregator signalAggregator;
    private final MarketDataProperties properties;
    private final Clock clock;

    /**
     * Snapshot per configured timeframe plus their consensus. Never throws for a valid symbol:
     * an unexpected failure comes back as an analysis carrying {@code error}.
     */
    public MultiTimeframeAnalysis getMultiTimeframeAnalysis(String symbol) {
        String normalized = normalizeSymbol(symbol);
        try {
            Map<String, IndicatorSnapshot> snapshots = new LinkedHashMap<>();
            int lookback = properties.getAnalysis().getLookback();
            for (String timeframe : properties.getTimeframes()) {
                snapshots.put(timeframe, computeTimeframe(normalized, timeframe, lookback));
            }
            return MultiTimeframeAnalysis.builder()
                    .symbol(normalized)
                    .timeframes(snapshots)
                    .overallSignals(signalAggregator.aggregate(snapshots.values()))
                    .analysisTimestamp(Instant.now(clock))
                    .build();
        } catch (RuntimeException e) {
            log.error("Multi-timeframe analysis failed for {}: {}", normalized, e.getMessage(), e);
            return MultiTimeframeAnalysis.builder()
                    .symbol(normalized)
                    .timeframes(Map.of())
                    .overallSignals(new ConsensusSignal())
                    .analysisTimestamp(Instant.now(clock))
                    .error(describe(e))
                    .build();
        }
    }

    private IndicatorSnapshot computeTimeframe(String symbol, String timeframe, int lookback) {
        try {
            List<Kline> klines = klineCache.get(symbol, timeframe, lookback);
            return indicatorEngine.compute(symbol, timeframe, klines);
        } catch (RuntimeException e) {
            log.warn("Indicator computation failed for {} {}: {}", symbol, timeframe, e.getMessage(), e);
            return IndicatorSnapshot.failed(symbol, timeframe, describe(e));
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public List<Kline> getKlines(String symbol, String timeframe, Integer limit) {
        if (timeframe == null || timeframe.isBlank()) {
            throw new IllegalArgumentException("timeframe is required");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        return klineCache.get(normalizeSymbol(symbol), timeframe.trim(), limit);
    }

    static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
