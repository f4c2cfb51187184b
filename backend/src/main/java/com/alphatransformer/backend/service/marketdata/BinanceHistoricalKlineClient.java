package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.exception.MarketDataException;
import com.alphatransformer.backend.model.Kline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * REST client for {@code /fapi/v1/klines}. Rows are arrays
 * {@code [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades, takerBase, takerQuote, ...]}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceHistoricalKlineClient implements HistoricalKlineClient {

    private static final String KLINES_PATH = "/fapi/v1/klines";

    private final RestTemplate marketRestTemplate;
    private final Retry marketRestRetry;
    private final ObjectMapper objectMapper;
    private final MarketDataProperties properties;
    private final Clock clock;

    @Override
    public List<Kline> fetchKlines(String symbol, String interval, int limit) {
        String normalized = symbol.toUpperCase(Locale.ROOT);
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getRest().getBaseUrl())
                .path(KLINES_PATH)
                .queryParam("symbol", normalized)
                .queryParam("interval", interval)
                .queryParam("limit", limit)
                .build()
                .toUri();
        Supplier<String> request = Retry.decorateSupplier(marketRestRetry,
                () -> marketRestTemplate.getForObject(uri, String.class));
        try {
            List<Kline> klines = parseRows(request.get(), normalized, interval);
            log.debug("Fetched {} historical klines {} {}", klines.size(), normalized, interval);
            return klines;
        } catch (RestClientException | MarketDataException e) {
            log.error("Historical kline fetch failed {} {}: {}", normalized, interval, e.getMessage());
            return Collections.emptyList();
        }
    }

    List<Kline> parseRows(String body, String symbol, String interval) {
        if (body == null || body.isBlank()) {
            throw new MarketDataException("Empty kline response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Invalid kline response: " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            throw new MarketDataException("Kline response is not an array: " + abbreviate(body));
        }
        long now = clock.millis();
        List<Kline> klines = new ArrayList<>(root.size());
        for (JsonNode row : root) {
            if (!row.isArray() || row.size() < 11) {
                throw new MarketDataException("Kline row has unexpected shape: " + row);
            }
            long closeTime = row.get(6).asLong();
            klines.add(Kline.builder()
                    .symbol(symbol)
                    .timeframe(interval)
                    .openTime(row.get(0).asLong())
                    .open(decimal(row, 1))
                    .high(decimal(row, 2))
                    .low(decimal(row, 3))
                    .close(decimal(row, 4))
                    .volume(decimal(row, 5))
                    .closeTime(closeTime)
                    .quoteVolume(decimal(row, 7))
                    .tradeCount(row.get(8).asLong())
                    .takerBuyBaseVolume(decimal(row, 9))
                    .takerBuyQuoteVolume(decimal(row, 10))
                    // the newest row is the still-open candle
                    .isFinal(closeTime < now)
                    .build());
        }
        return klines;
    }

    private static double decimal(JsonNode row, int index) {
        String raw = row.get(index).asText();
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new MarketDataException("Kline field " + index + " is not a number: " + raw, e);
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
