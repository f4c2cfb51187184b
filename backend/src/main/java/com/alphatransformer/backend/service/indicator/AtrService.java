package com.alphatransformer.backend.service.indicator;

import com.alphatransformer.backend.model.Kline;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

@Service
public class AtrService {

    public OptionalDouble atr(List<Kline> klines, int period) {
        if (klines == null || period <= 0 || klines.size() < period + 1) {
            return OptionalDouble.empty();
        }
        List<Double> tr = trueRanges(klines);
        double atr = tr.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < tr.size(); i++) {
            atr = ((atr * (period - 1)) + tr.get(i)) / period;
        }
        return OptionalDouble.of(atr);
    }

    /**
     * ATR as a percentage of the last close. Empty when the close is not positive.
     */
    public OptionalDouble natr(List<Kline> klines, int period) {
        OptionalDouble atr = atr(klines, period);
        if (atr.isEmpty()) {
            return atr;
        }
        double lastClose = klines.get(klines.size() - 1).getClose();
        if (lastClose <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(atr.getAsDouble() / lastClose * 100.0);
    }

    static List<Double> trueRanges(List<Kline> klines) {
        List<Double> tr = new ArrayList<>(klines.size());
        for (int i = 1; i < klines.size(); i++) {
            Kline curr = klines.get(i);
            Kline prev = klines.get(i - 1);
            tr.add(Math.max(curr.getHigh() - curr.getLow(),
                    Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose()))));
        }
        return tr;
    }
}
