package com.alphatransformer.backend.controller;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.dto.DiagnosticsResponse;
import com.alphatransformer.backend.service.KlineCache;
import com.alphatransformer.backend.service.marketdata.KlineStreamIngestor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/diagnostics")
@RequiredArgsConstructor
@Tag(name = "Diagnostics")
public class DiagnosticsController {

    private final MarketDataProperties properties;
    private final KlineCache klineCache;
    private final KlineStreamIngestor klineStreamIngestor;

    @GetMapping
    @Operation(summary = "Cache occupancy and stream connection status")
    public ResponseEntity<DiagnosticsResponse> getDiagnostics() {
        DiagnosticsResponse response = DiagnosticsResponse.builder()
                .streamEnabled(properties.getStream().isEnabled())
                .stream(klineStreamIngestor.status())
                .cache(klineCache.diagnostics())
                .build();
        return ResponseEntity.ok(response);
    }
}
