package com.alphatransformer.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One OHLCV bar for a (symbol, timeframe) bucket as delivered by the exchange.
 * {@code openTime} is the unique key of a candle within its series.
 */
@Value
@Builder(toBuilder = true)
public class Kline {
    String symbol;
    String timeframe;
    long openTime;
    long closeTime;
    double open;
    double high;
    double low;
    double close;
    double volume;
    double quoteVolume;
    long tradeCount;
    double takerBuyBaseVolume;
    double takerBuyQuoteVolume;
    boolean isFinal;

    public Instant openInstant() {
        return Instant.ofEpochMilli(openTime);
    }
}
