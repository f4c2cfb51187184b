package com.alphatransformer.backend.service;

import com.alphatransformer.backend.dto.ConsensusSignal;
import com.alphatransformer.backend.dto.IndicatorSnapshot;
import com.alphatransformer.backend.model.BandSignal;
import com.alphatransformer.backend.model.MarketRegime;
import com.alphatransformer.backend.model.MomentumBias;
import com.alphatransformer.backend.model.RsiSignal;
import com.alphatransformer.backend.model.TrendDirection;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Merges the per-timeframe snapshots of one symbol into a cross-timeframe consensus.
 * Snapshots carrying an error do not vote. An aggregate nobody contributes to stays null.
 */
@Service
public class SignalAggregator {

    public ConsensusSignal aggregate(Collection<IndicatorSnapshot> snapshots) {
        List<IndicatorSnapshot> usable = snapshots.stream()
                .filter(Objects::nonNull)
                .filter(snapshot -> !snapshot.hasError())
                .toList();

        ConsensusSignal.ConsensusSignalBuilder signal = ConsensusSignal.builder();

        long bothEmas = usable.stream()
                .filter(s -> s.getEma20() != null && s.getEma50() != null)
                .count();
        if (bothEmas > 0) {
            long upward = usable.stream()
                    .filter(s -> s.getEma20() != null && s.getEma50() != null)
                    .filter(s -> s.getEma20() > s.getEma50())
                    .count();
            double consistency = (double) upward / bothEmas;
            signal.trendConsistency(consistency)
                    .trendDirection(TrendDirection.fromConsistency(consistency));
        }

        OptionalDouble rsi7 = average(usable, IndicatorSnapshot::getRsi7);
        if (rsi7.isPresent()) {
            signal.averageRsi7(rsi7.getAsDouble()).rsi7Signal(RsiSignal.fromRsi(rsi7.getAsDouble()));
        }
        OptionalDouble rsi14 = average(usable, IndicatorSnapshot::getRsi14);
        if (rsi14.isPresent()) {
            signal.averageRsi14(rsi14.getAsDouble()).rsi14Signal(RsiSignal.fromRsi(rsi14.getAsDouble()));
        }

        OptionalDouble histogram = average(usable, IndicatorSnapshot::getMacdHistogram);
        if (histogram.isPresent()) {
            signal.macdConsensus(histogram.getAsDouble() > 0 ? MomentumBias.BULLISH : MomentumBias.BEARISH);
        }

        OptionalDouble adx = average(usable, IndicatorSnapshot::getAdx);
        if (adx.isPresent()) {
            signal.averageAdx(adx.getAsDouble()).marketRegime(MarketRegime.fromAverageAdx(adx.getAsDouble()));
        }

        OptionalDouble position = average(usable, IndicatorSnapshot::getBollingerPosition);
        if (position.isPresent()) {
            signal.averageBollingerPosition(position.getAsDouble())
                    .bollingerSignal(BandSignal.fromPosition(position.getAsDouble()));
        }

        List<MomentumBias> obvTrends = usable.stream()
                .map(IndicatorSnapshot::getObvTrend)
                .filter(Objects::nonNull)
                .toList();
        if (!obvTrends.isEmpty()) {
            long bullish = obvTrends.stream().filter(t -> t == MomentumBias.BULLISH).count();
            long bearish = obvTrends.stream().filter(t -> t == MomentumBias.BEARISH).count();
            signal.obvConsensus(bullish > bearish ? MomentumBias.BULLISH
                    : bearish > bullish ? MomentumBias.BEARISH : MomentumBias.NEUTRAL);
        }

        return signal.build();
    }

    private OptionalDouble average(List<IndicatorSnapshot> snapshots, Function<IndicatorSnapshot, Double> field) {
        return snapshots.stream()
                .map(field)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
    }
}
