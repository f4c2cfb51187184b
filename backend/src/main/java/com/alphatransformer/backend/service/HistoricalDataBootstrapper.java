package com.alphatransformer.backend.service;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.service.marketdata.HistoricalKlineClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Warms the cache from the REST history before the live stream starts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalDataBootstrapper {

    private final HistoricalKlineClient historicalKlineClient;
    private final KlineCache klineCache;
    private final MarketDataProperties properties;

    /**
     * @return number of klines accepted by the cache
     */
    public int initialize() {
        int limit = properties.getRest().getHistoryLimit();
        int loaded = 0;
        for (String symbol : properties.getSymbols()) {
            for (String timeframe : properties.getTimeframes()) {
                List<Kline> klines = historicalKlineClient.fetchKlines(symbol, timeframe, limit);
                int accepted = 0;
                for (Kline kline : klines) {
                    if (klineCache.upsert(kline).isAccepted()) {
                        accepted++;
                    }
                }
                if (klines.isEmpty()) {
                    log.warn("No history loaded for {} {}", symbol, timeframe);
                } else {
                    log.info("Loaded {} historical klines for {} {}", accepted, symbol, timeframe);
                }
                loaded += accepted;
            }
        }
        log.info("Historical bootstrap finished, {} klines cached", loaded);
        return loaded;
    }
}
