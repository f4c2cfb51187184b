package com.alphatransformer.backend.service;

import com.alphatransformer.backend.dto.IndicatorSnapshot;
import com.alphatransformer.backend.model.BandSignal;
import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.model.MomentumBias;
import com.alphatransformer.backend.model.TrendStrength;
import com.alphatransformer.backend.model.VwapSignal;
import com.alphatransformer.backend.service.indicator.AdxService;
import com.alphatransformer.backend.service.indicator.AtrService;
import com.alphatransformer.backend.service.indicator.BollingerBandService;
import com.alphatransformer.backend.service.indicator.EmaService;
import com.alphatransformer.backend.service.indicator.MacdService;
import com.alphatransformer.backend.service.indicator.RsiService;
import com.alphatransformer.backend.service.indicator.SupportResistanceService;
import com.alphatransformer.backend.service.indicator.VolumeIndicatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Computes the indicator snapshot of one (symbol, timeframe) series.
 * Pure over its input: the list is a cache copy, oldest first.
 */
@Service
@RequiredArgsConstructor
public class IndicatorEngine {

    static final int EMA_FAST = 20;
    static final int EMA_SLOW = 50;
    static final int RSI_SHORT = 7;
    static final int RSI_LONG = 14;
    static final int ATR_PERIOD = 14;
    static final int BOLLINGER_PERIOD = 20;
    static final double BOLLINGER_DEVIATION = 2.0;
    static final int ADX_PERIOD = 14;
    static final int VWAP_LOOKBACK = 50;
    static final int LEVELS_WINDOW = 20;

    private final EmaService emaService;
    private final MacdService macdService;
    private final RsiService rsiService;
    private final AtrService atrService;
    private final AdxService adxService;
    private final BollingerBandService bollingerBandService;
    private final VolumeIndicatorService volumeIndicatorService;
    private final SupportResistanceService supportResistanceService;

    public IndicatorSnapshot compute(String symbol, String timeframe, List<Kline> klines) {
        if (klines == null || klines.isEmpty()) {
            return IndicatorSnapshot.noData(symbol, timeframe);
        }
        List<Double> closes = klines.stream().map(Kline::getClose).toList();
        Kline latest = klines.get(klines.size() - 1);
        double price = latest.getClose();

        IndicatorSnapshot.IndicatorSnapshotBuilder snapshot = IndicatorSnapshot.builder()
                .symbol(symbol)
                .timeframe(timeframe)
                .currentPrice(price)
                .dataPointCount(klines.size())
                .latestOpenTime(latest.openInstant());

        applyPriceChange(snapshot, closes);

        snapshot.ema20(value(emaService.latest(closes, EMA_FAST)));
        snapshot.ema50(value(emaService.latest(closes, EMA_SLOW)));

        macdService.calculate(closes).ifPresent(macd -> snapshot
                .macdLine(macd.macdLine())
                .macdSignal(macd.signalLine())
                .macdHistogram(macd.histogram()));

        snapshot.rsi7(value(rsiService.calculate(closes, RSI_SHORT)));
        snapshot.rsi14(value(rsiService.calculate(closes, RSI_LONG)));
        snapshot.natr(value(atrService.natr(klines, ATR_PERIOD)));

        bollingerBandService.calculate(closes, BOLLINGER_PERIOD, BOLLINGER_DEVIATION).ifPresent(bands -> {
            Double position = bands.position(price);
            snapshot.bollingerUpper(bands.upper())
                    .bollingerMiddle(bands.middle())
                    .bollingerLower(bands.lower())
                    .bollingerPosition(position)
                    .bollingerSignal(position == null ? null : BandSignal.fromPosition(position));
        });

        adxService.calculate(klines, ADX_PERIOD).ifPresent(adx -> snapshot
                .adx(adx.adx())
                .trendStrength(TrendStrength.fromAdx(adx.adx())));

        double[] obv = volumeIndicatorService.obvSeries(klines);
        snapshot.obv(obv[obv.length - 1]);
        OptionalDouble slope = volumeIndicatorService.obvSlope(obv);
        if (slope.isPresent()) {
            snapshot.obvTrend(MomentumBias.fromSlope(slope.getAsDouble()));
        }

        OptionalDouble vwap = volumeIndicatorService.vwap(klines, VWAP_LOOKBACK);
        if (vwap.isPresent()) {
            double ratio = volumeIndicatorService.vwapRatio(price, vwap.getAsDouble());
            snapshot.vwap(vwap.getAsDouble())
                    .vwapRatio(ratio)
                    .vwapSignal(VwapSignal.fromRatio(ratio));
        }

        supportResistanceService.calculate(klines, LEVELS_WINDOW, price).ifPresent(levels -> snapshot
                .supportLevel(levels.support())
                .resistanceLevel(levels.resistance())
                .distanceToSupportPct(levels.distanceToSupportPct())
                .distanceToResistancePct(levels.distanceToResistancePct()));

        return snapshot.build();
    }

    private void applyPriceChange(IndicatorSnapshot.IndicatorSnapshotBuilder snapshot, List<Double> closes) {
        if (closes.size() < 2) {
            snapshot.priceChange(0.0).priceChangePercent(0.0);
            return;
        }
        double last = closes.get(closes.size() - 1);
        double previous = closes.get(closes.size() - 2);
        double change = last - previous;
        snapshot.priceChange(change)
                .priceChangePercent(previous > 0 ? change / previous * 100.0 : 0.0);
    }

    private static Double value(OptionalDouble optional) {
        return optional.isPresent() ? optional.getAsDouble() : null;
    }
}
