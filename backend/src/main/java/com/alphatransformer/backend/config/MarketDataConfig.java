package com.alphatransformer.backend.config;

import com.alphatransformer.backend.service.KlineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MarketDataConfig {

    @Bean
    public KlineCache klineCache(MarketDataProperties properties) {
        KlineCache cache = new KlineCache(properties.getCache().getCapacity());
        for (String symbol : properties.getSymbols()) {
            for (String timeframe : properties.getTimeframes()) {
                cache.register(symbol, timeframe);
            }
        }
        return cache;
    }

    @Bean
    public Clock marketClock() {
        return Clock.systemUTC();
    }
}
