package com.alphatransformer.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class BollingerBandService {

    public Optional<BollingerBands> calculate(List<Double> closes, int period, double deviation) {
        if (closes == null || period <= 0 || closes.size() < period) {
            return Optional.empty();
        }
        List<Double> window = closes.subList(closes.size() - period, closes.size());
        double mean = window.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = window.stream()
                .mapToDouble(close -> {
                    double diff = close - mean;
                    return diff * diff;
                })
                .average()
                .orElse(0.0);
        double standardDeviation = Math.sqrt(variance);
        double upper = mean + (standardDeviation * deviation);
        double lower = mean - (standardDeviation * deviation);
        return Optional.of(new BollingerBands(upper, mean, lower));
    }

    public record BollingerBands(double upper, double middle, double lower) {

        /**
         * Where {@code price} sits inside the band, 0 at the lower and 1 at the upper line.
         * Null for a collapsed band.
         */
        public Double position(double price) {
            if (upper == lower) {
                return null;
            }
            return (price - lower) / (upper - lower);
        }
    }
}
