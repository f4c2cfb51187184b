package com.alphatransformer.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

@Service
public class EmaService {

    public OptionalDouble latest(List<Double> values, int period) {
        List<Double> series = series(values, period);
        if (series.isEmpty()) {
            return OptionalDouble.empty();
        }
        Double last = series.get(series.size() - 1);
        return last == null ? OptionalDouble.empty() : OptionalDouble.of(last);
    }

    /**
     * EMA aligned with {@code values}; entries before {@code period - 1} are null.
     * The first defined value is the simple average of the first {@code period} values.
     */
    public List<Double> series(List<Double> values, int period) {
        List<Double> emaSeries = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            emaSeries.add(null);
        }
        if (period <= 0 || values.size() < period) {
            return emaSeries;
        }
        double sma = values.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        emaSeries.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }
}
