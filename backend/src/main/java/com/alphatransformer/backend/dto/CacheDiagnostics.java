package com.alphatransformer.backend.dto;

import java.util.Map;

/**
 * Per-series candle counts. {@code symbolDetails} maps symbol to timeframe to count.
 */
public record CacheDiagnostics(
        int totalSymbols,
        int maxKlinesPerTimeframe,
        Map<String, SymbolDetail> symbolDetails
) {

    public record SymbolDetail(Map<String, Integer> timeframes, int totalKlines) {}
}
