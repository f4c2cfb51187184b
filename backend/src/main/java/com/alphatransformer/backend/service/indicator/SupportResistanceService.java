package com.alphatransformer.backend.service.indicator;

import com.alphatransformer.backend.model.Kline;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class SupportResistanceService {

    public Optional<Levels> calculate(List<Kline> klines, int window, double price) {
        if (klines == null || window <= 0 || klines.size() < window) {
            return Optional.empty();
        }
        List<Kline> recent = klines.subList(klines.size() - window, klines.size());
        double support = recent.stream().mapToDouble(Kline::getLow).min().orElse(0.0);
        double resistance = recent.stream().mapToDouble(Kline::getHigh).max().orElse(0.0);
        if (resistance <= support) {
            return Optional.of(new Levels(support, resistance, null, null));
        }
        double range = resistance - support;
        double toSupport = (price - support) / range * 100.0;
        double toResistance = (resistance - price) / range * 100.0;
        return Optional.of(new Levels(support, resistance, toSupport, toResistance));
    }

    public record Levels(double support, double resistance, Double distanceToSupportPct, Double distanceToResistancePct) {}
}
