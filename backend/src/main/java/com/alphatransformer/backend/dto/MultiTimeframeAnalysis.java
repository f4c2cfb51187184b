package com.alphatransformer.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MultiTimeframeAnalysis {

    private String symbol;
    private Map<String, IndicatorSnapshot> timeframes;
    private ConsensusSignal overallSignals;
    private Instant analysisTimestamp;
    private String error;
}
