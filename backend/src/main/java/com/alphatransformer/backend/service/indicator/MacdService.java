package com.alphatransformer.backend.service.indicator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class MacdService {

    public static final int FAST_PERIOD = 12;
    public static final int SLOW_PERIOD = 26;
    public static final int SIGNAL_PERIOD = 9;

    private final EmaService emaService;

    /**
     * Empty below {@link #SLOW_PERIOD} closes. The signal line and histogram stay null
     * until {@link #SIGNAL_PERIOD} MACD values exist.
     */
    public Optional<MacdResult> calculate(List<Double> closes) {
        if (closes == null || closes.size() < SLOW_PERIOD) {
            return Optional.empty();
        }
        List<Double> fastSeries = emaService.series(closes, FAST_PERIOD);
        List<Double> slowSeries = emaService.series(closes, SLOW_PERIOD);

        List<Double> macdSeries = new ArrayList<>();
        for (int i = 0; i < closes.size(); i++) {
            Double fastVal = fastSeries.get(i);
            Double slowVal = slowSeries.get(i);
            if (fastVal != null && slowVal != null) {
                macdSeries.add(fastVal - slowVal);
            }
        }

        double macdLine = macdSeries.get(macdSeries.size() - 1);
        if (macdSeries.size() < SIGNAL_PERIOD) {
            return Optional.of(new MacdResult(macdLine, null, null));
        }
        List<Double> signalSeries = emaService.series(macdSeries, SIGNAL_PERIOD);
        double signalLine = signalSeries.get(signalSeries.size() - 1);
        return Optional.of(new MacdResult(macdLine, signalLine, macdLine - signalLine));
    }

    public record MacdResult(double macdLine, Double signalLine, Double histogram) {}
}
