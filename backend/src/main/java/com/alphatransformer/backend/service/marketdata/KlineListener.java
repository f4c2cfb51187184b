package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.model.UpsertOutcome;

/**
 * Notified on the ingestion thread after a streamed kline was accepted by the cache.
 * Implementations must return quickly; exceptions are logged and do not reach other listeners.
 */
@FunctionalInterface
public interface KlineListener {

    void onKline(Kline kline, UpsertOutcome outcome);
}
