package com.alphatransformer.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.OptionalDouble;

@Service
public class RsiService {

    /**
     * Wilder RSI. Needs {@code period + 1} closes. A flat series reads 50.
     */
    public OptionalDouble calculate(List<Double> closes, int period) {
        if (closes == null || period <= 0 || closes.size() < period + 1) {
            return OptionalDouble.empty();
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < closes.size(); i++) {
            double change = closes.get(i) - closes.get(i - 1);
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = ((avgGain * (period - 1)) + gain) / period;
            avgLoss = ((avgLoss * (period - 1)) + loss) / period;
        }

        if (avgGain == 0 && avgLoss == 0) {
            return OptionalDouble.of(50.0);
        }
        if (avgLoss == 0) {
            return OptionalDouble.of(100.0);
        }
        double rs = avgGain / avgLoss;
        return OptionalDouble.of(100.0 - (100.0 / (1.0 + rs)));
    }
}
