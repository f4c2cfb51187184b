package com.alphatransformer.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "market")
@Data
@Validated
public class MarketDataProperties {

    @NotBlank
    private String exchange = "binance";
    @NotEmpty
    private List<String> symbols = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT"));
    @NotEmpty
    private List<String> timeframes = new ArrayList<>(List.of("3m", "1h", "4h"));

    @Valid
    private Cache cache = new Cache();
    @Valid
    private Stream stream = new Stream();
    @Valid
    private Rest rest = new Rest();
    private Bootstrap bootstrap = new Bootstrap();
    @Valid
    private Analysis analysis = new Analysis();

    @Data
    public static class Cache {
        @Min(1)
        private int capacity = 100;
    }

    @Data
    public static class Stream {
        private boolean enabled = true;
        @NotBlank
        private String url = "wss://fstream.binance.com/stream";
        @Min(1)
        private long connectTimeoutMs = 10_000;
        private long pingIntervalSeconds = 20;
        @Min(0)
        private int maxReconnectAttempts = 10;
        private long reconnectDelayMs = 3_000;
        private long subscribeDelayMs = 100;
    }

    @Data
    public static class Rest {
        @NotBlank
        private String baseUrl = "https://fapi.binance.com";
        @Min(1)
        private int historyLimit = 100;
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 10_000;
        private int retryMaxAttempts = 3;
        private long retryBaseDelayMs = 500;
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = true;
    }

    @Data
    public static class Analysis {
        @Min(1)
        private int lookback = 200;
    }
}
