package com.alphatransformer.backend.controller;

import com.alphatransformer.backend.dto.MultiTimeframeAnalysis;
import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.service.MarketAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
@Tag(name = "Market")
public class MarketAnalysisController {

    private final MarketAnalysisService marketAnalysisService;

    @GetMapping("/analysis/{symbol}")
    @Operation(summary = "Multi-timeframe indicators and consensus for a symbol")
    public ResponseEntity<MultiTimeframeAnalysis> getAnalysis(@PathVariable String symbol) {
        return ResponseEntity.ok(marketAnalysisService.getMultiTimeframeAnalysis(symbol));
    }

    @GetMapping("/klines/{symbol}/{timeframe}")
    @Operation(summary = "Cached klines, oldest first")
    public ResponseEntity<List<Kline>> getKlines(@PathVariable String symbol,
                                                @PathVariable String timeframe,
                                                @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(marketAnalysisService.getKlines(symbol, timeframe, limit));
    }
}
