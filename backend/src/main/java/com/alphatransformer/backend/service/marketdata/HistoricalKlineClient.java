package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.model.Kline;

import java.util.List;

public interface HistoricalKlineClient {

    /**
     * Recent klines oldest first, or an empty list when the exchange cannot be reached.
     */
    List<Kline> fetchKlines(String symbol, String interval, int limit);
}
