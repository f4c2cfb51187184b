package com.alphatransformer.backend.service.indicator;

import com.alphatransformer.backend.model.Kline;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class AdxService {

    /**
     * Wilder ADX. The first value needs {@code 2 * period} klines: {@code period} true
     * ranges to seed the smoothing, then {@code period} DX values to seed the average.
     */
    public Optional<AdxResult> calculate(List<Kline> klines, int period) {
        if (klines == null || period <= 0 || klines.size() < 2 * period) {
            return Optional.empty();
        }

        List<Double> tr = AtrService.trueRanges(klines);
        List<Double> dmPlus = new ArrayList<>();
        List<Double> dmMinus = new ArrayList<>();
        for (int i = 1; i < klines.size(); i++) {
            Kline curr = klines.get(i);
            Kline prev = klines.get(i - 1);
            double highDiff = curr.getHigh() - prev.getHigh();
            double lowDiff = prev.getLow() - curr.getLow();
            dmPlus.add((highDiff > lowDiff && highDiff > 0) ? highDiff : 0.0);
            dmMinus.add((lowDiff > highDiff && lowDiff > 0) ? lowDiff : 0.0);
        }

        double smoothTR = tr.subList(0, period).stream().mapToDouble(Double::doubleValue).sum();
        double smoothPlus = dmPlus.subList(0, period).stream().mapToDouble(Double::doubleValue).sum();
        double smoothMinus = dmMinus.subList(0, period).stream().mapToDouble(Double::doubleValue).sum();

        List<Double> dxValues = new ArrayList<>();
        double plusDI = 0.0;
        double minusDI = 0.0;

        for (int i = period - 1; i < tr.size(); i++) {
            if (i > period - 1) {
                smoothTR = smoothTR - (smoothTR / period) + tr.get(i);
                smoothPlus = smoothPlus - (smoothPlus / period) + dmPlus.get(i);
                smoothMinus = smoothMinus - (smoothMinus / period) + dmMinus.get(i);
            }
            // no range at all: directional movement is undefined, count it as no trend
            if (smoothTR == 0) {
                plusDI = 0.0;
                minusDI = 0.0;
                dxValues.add(0.0);
                continue;
            }
            plusDI = 100.0 * (smoothPlus / smoothTR);
            minusDI = 100.0 * (smoothMinus / smoothTR);
            double diSum = plusDI + minusDI;
            double dx = diSum == 0 ? 0.0 : (Math.abs(plusDI - minusDI) / diSum) * 100.0;
            dxValues.add(dx);
        }

        double adx = dxValues.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < dxValues.size(); i++) {
            adx = ((adx * (period - 1)) + dxValues.get(i)) / period;
        }
        return Optional.of(new AdxResult(adx, plusDI, minusDI));
    }

    public record AdxResult(double adx, double plusDI, double minusDI) {}
}
