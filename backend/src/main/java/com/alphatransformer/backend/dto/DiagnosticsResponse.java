package com.alphatransformer.backend.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DiagnosticsResponse {
    private boolean streamEnabled;
    private StreamStatus stream;
    private CacheDiagnostics cache;
}
