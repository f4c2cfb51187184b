package com.alphatransformer.backend.service.indicator;

import com.alphatransformer.backend.model.Kline;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

@Service
public class VolumeIndicatorService {

    public static final int OBV_TREND_WINDOW = 5;

    /**
     * On-balance volume series, seeded with the first kline's volume.
     */
    public double[] obvSeries(List<Kline> klines) {
        double[] obv = new double[klines.size()];
        if (klines.isEmpty()) {
            return obv;
        }
        obv[0] = klines.get(0).getVolume();
        for (int i = 1; i < klines.size(); i++) {
            double close = klines.get(i).getClose();
            double prevClose = klines.get(i - 1).getClose();
            double volume = klines.get(i).getVolume();
            if (close > prevClose) {
                obv[i] = obv[i - 1] + volume;
            } else if (close < prevClose) {
                obv[i] = obv[i - 1] - volume;
            } else {
                obv[i] = obv[i - 1];
            }
        }
        return obv;
    }

    /**
     * Average OBV change per bar across the last {@link #OBV_TREND_WINDOW} values.
     */
    public OptionalDouble obvSlope(double[] obv) {
        if (obv.length < OBV_TREND_WINDOW) {
            return OptionalDouble.empty();
        }
        int last = obv.length - 1;
        return OptionalDouble.of((obv[last] - obv[last - (OBV_TREND_WINDOW - 1)]) / OBV_TREND_WINDOW);
    }

    /**
     * Close-weighted VWAP over the newest {@code lookback} klines. Empty when they carry no volume.
     */
    public OptionalDouble vwap(List<Kline> klines, int lookback) {
        if (klines == null || klines.isEmpty()) {
            return OptionalDouble.empty();
        }
        List<Kline> window = klines.subList(Math.max(0, klines.size() - lookback), klines.size());
        double weighted = 0.0;
        double totalVolume = 0.0;
        for (Kline kline : window) {
            weighted += kline.getClose() * kline.getVolume();
            totalVolume += kline.getVolume();
        }
        if (totalVolume <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(weighted / totalVolume);
    }

    public double vwapRatio(double price, double vwap) {
        return vwap > 0 ? (price - vwap) / vwap * 100.0 : 0.0;
    }
}
