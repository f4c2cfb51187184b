package com.alphatransformer.backend.service;

import com.alphatransformer.backend.dto.CacheDiagnostics;
import com.alphatransformer.backend.model.Kline;
import com.alphatransformer.backend.model.UpsertOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded rolling window of klines per (symbol, timeframe), ordered by open time.
 * <p>
 * Only the newest entry of a series may be provisional: appending a later candle seals
 * the previous one. A final candle is never
 * reopened, and updates older than the newest entry are dropped. Every read
 * returns a copy, so callers never observe a series while it is mutated.
 */
@Slf4j
public class KlineCache {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Map<String, ArrayDeque<Kline>>> series = new LinkedHashMap<>();

    public KlineCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Creates an empty series so diagnostics list the pair before its first candle.
     */
    public void register(String symbol, String timeframe) {
        lock.lock();
        try {
            seriesFor(symbol, timeframe);
        } finally {
            lock.unlock();
        }
    }

    public UpsertOutcome upsert(Kline kline) {
        if (kline == null) {
            throw new IllegalArgumentException("kline must not be null");
        }
        if (kline.getSymbol() == null || kline.getTimeframe() == null) {
            throw new IllegalArgumentException("kline symbol and timeframe are required");
        }
        lock.lock();
        try {
            ArrayDeque<Kline> deque = seriesFor(kline.getSymbol(), kline.getTimeframe());
            Kline newest = deque.peekLast();
            if (newest == null || kline.getOpenTime() > newest.getOpenTime()) {
                if (newest != null && !newest.isFinal()) {
                    // closing frame never arrived; the candle is over once a later one opens
                    log.warn("Sealing provisional kline {} {} openTime={} superseded by openTime={}",
                            newest.getSymbol(), newest.getTimeframe(), newest.getOpenTime(), kline.getOpenTime());
                    deque.removeLast();
                    deque.addLast(newest.toBuilder().isFinal(true).build());
                }
                deque.addLast(kline);
                while (deque.size() > capacity) {
                    deque.removeFirst();
                }
                return UpsertOutcome.APPENDED;
            }
            if (kline.getOpenTime() == newest.getOpenTime()) {
                if (newest.isFinal() && !kline.isFinal()) {
                    log.debug("Rejected reopen of final kline {} {} openTime={}",
                            kline.getSymbol(), kline.getTimeframe(), kline.getOpenTime());
                    return UpsertOutcome.REJECTED;
                }
                deque.removeLast();
                deque.addLast(kline);
                return UpsertOutcome.REPLACED;
            }
            log.debug("Rejected out-of-order kline {} {} openTime={} newest={}",
                    kline.getSymbol(), kline.getTimeframe(), kline.getOpenTime(), newest.getOpenTime());
            return UpsertOutcome.REJECTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Newest {@code limit} klines, oldest first. A null or non-positive limit returns the whole series.
     */
    public List<Kline> get(String symbol, String timeframe, Integer limit) {
        lock.lock();
        try {
            ArrayDeque<Kline> deque = find(symbol, timeframe);
            if (deque == null || deque.isEmpty()) {
                return Collections.emptyList();
            }
            int take = (limit == null || limit <= 0) ? deque.size() : Math.min(limit, deque.size());
            List<Kline> result = new ArrayList<>(take);
            Iterator<Kline> it = deque.iterator();
            int skip = deque.size() - take;
            while (it.hasNext()) {
                Kline kline = it.next();
                if (skip > 0) {
                    skip--;
                    continue;
                }
                result.add(kline);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Kline> getLatest(String symbol, String timeframe) {
        lock.lock();
        try {
            ArrayDeque<Kline> deque = find(symbol, timeframe);
            return deque == null ? Optional.empty() : Optional.ofNullable(deque.peekLast());
        } finally {
            lock.unlock();
        }
    }

    public CacheDiagnostics diagnostics() {
        lock.lock();
        try {
            Map<String, CacheDiagnostics.SymbolDetail> details = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, ArrayDeque<Kline>>> symbolEntry : series.entrySet()) {
                Map<String, Integer> counts = new LinkedHashMap<>();
                int total = 0;
                for (Map.Entry<String, ArrayDeque<Kline>> tfEntry : symbolEntry.getValue().entrySet()) {
                    int size = tfEntry.getValue().size();
                    counts.put(tfEntry.getKey(), size);
                    total += size;
                }
                details.put(symbolEntry.getKey(), new CacheDiagnostics.SymbolDetail(counts, total));
            }
            return new CacheDiagnostics(series.size(), capacity, details);
        } finally {
            lock.unlock();
        }
    }

    private ArrayDeque<Kline> seriesFor(String symbol, String timeframe) {
        return series.computeIfAbsent(symbol, key -> new LinkedHashMap<>())
                .computeIfAbsent(timeframe, key -> new ArrayDeque<>(capacity + 1));
    }

    private ArrayDeque<Kline> find(String symbol, String timeframe) {
        Map<String, ArrayDeque<Kline>> bySymbol = series.get(symbol);
        return bySymbol == null ? null : bySymbol.get(timeframe);
    }
}
