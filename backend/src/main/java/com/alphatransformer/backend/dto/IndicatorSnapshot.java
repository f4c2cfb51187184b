package com.alphatransformer.backend.dto;

import com.alphatransformer.backend.model.BandSignal;
import com.alphatransformer.backend.model.MomentumBias;
import com.alphatransformer.backend.model.TrendStrength;
import com.alphatransformer.backend.model.VwapSignal;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Indicators for one (symbol, timeframe) at the time of the request.
 * A {@code null} indicator means the series is too short for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndicatorSnapshot {

    private String symbol;
    private String timeframe;
    private String error;

    private Double currentPrice;
    private Double priceChange;
    private Double priceChangePercent;
    private int dataPointCount;
    private Instant latestOpenTime;

    private Double ema20;
    private Double ema50;

    private Double macdLine;
    private Double macdSignal;
    private Double macdHistogram;

    private Double rsi7;
    private Double rsi14;

    private Double natr;

    private Double bollingerUpper;
    private Double bollingerMiddle;
    private Double bollingerLower;
    private Double bollingerPosition;
    private BandSignal bollingerSignal;

    private Double adx;
    private TrendStrength trendStrength;

    private Double obv;
    private MomentumBias obvTrend;

    private Double vwap;
    private Double vwapRatio;
    private VwapSignal vwapSignal;

    private Double supportLevel;
    private Double resistanceLevel;
    private Double distanceToSupportPct;
    private Double distanceToResistancePct;

    public static IndicatorSnapshot noData(String symbol, String timeframe) {
        return IndicatorSnapshot.builder()
                .symbol(symbol)
                .timeframe(timeframe)
                .error("No cached data")
                .dataPointCount(0)
                .build();
    }

    public static IndicatorSnapshot failed(String symbol, String timeframe, String error) {
        return IndicatorSnapshot.builder()
                .symbol(symbol)
                .timeframe(timeframe)
                .error(error)
                .build();
    }

    public boolean hasError() {
        return error != null;
    }
}
