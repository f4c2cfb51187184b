package com.alphatransformer.backend.dto;

import com.alphatransformer.backend.model.BandSignal;
import com.alphatransformer.backend.model.MarketRegime;
import com.alphatransformer.backend.model.MomentumBias;
import com.alphatransformer.backend.model.RsiSignal;
import com.alphatransformer.backend.model.TrendDirection;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsensusSignal {

    private TrendDirection trendDirection;
    private Double trendConsistency;

    private Double averageRsi7;
    private RsiSignal rsi7Signal;
    private Double averageRsi14;
    private RsiSignal rsi14Signal;

    private MomentumBias macdConsensus;

    private Double averageAdx;
    private MarketRegime marketRegime;

    private Double averageBollingerPosition;
    private BandSignal bollingerSignal;

    private MomentumBias obvConsensus;
}
