package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.exception.MalformedFrameException;
import com.alphatransformer.backend.model.Kline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies combined-stream frames and maps kline events to {@link Kline}.
 */
@Component
@RequiredArgsConstructor
public class KlineFrameParser {

    private static final String KLINE_STREAM_MARKER = "@kline_";

    private final ObjectMapper objectMapper;

    public KlineFrame parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedFrameException("Empty frame");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }
        if (root.has("data") && root.get("data").isObject()) {
            String stream = root.path("stream").asText("");
            return KlineFrame.kline(toKline(root.get("data"), stream));
        }
        if (root.has("error")) {
            return KlineFrame.error(root.get("error").toString());
        }
        if (root.has("result")) {
            return KlineFrame.ack("id=" + root.path("id").asText("?") + " result=" + root.get("result"));
        }
        if (root.has("k")) {
            return KlineFrame.kline(toKline(root, ""));
        }
        throw new MalformedFrameException("Unrecognized frame shape");
    }

    /**
     * {@code {"method":"SUBSCRIBE","params":["btcusdt@kline_1h",...],"id":n}}
     */
    public String subscribeFrame(List<String> streams, int id) {
        try {
            return objectMapper.writeValueAsString(Map.of(
                    "method", "SUBSCRIBE",
                    "params", streams,
                    "id", id
            ));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode subscribe frame", e);
        }
    }

    public static String streamName(String symbol, String timeframe) {
        return symbol.toLowerCase(Locale.ROOT) + KLINE_STREAM_MARKER + timeframe;
    }

    private Kline toKline(JsonNode event, String stream) {
        JsonNode k = event.get("k");
        if (k == null || !k.isObject()) {
            throw new MalformedFrameException("Missing kline payload in stream " + stream);
        }
        String symbol = text(event, "s");
        if (symbol == null) {
            symbol = text(k, "s");
        }
        if (symbol == null) {
            throw new MalformedFrameException("Missing symbol in stream " + stream);
        }
        String timeframe = text(k, "i");
        if (timeframe == null) {
            timeframe = timeframeFromStream(stream);
        }
        JsonNode isFinal = k.get("x");
        if (isFinal == null || !isFinal.isBoolean()) {
            throw new MalformedFrameException("Field x must be a boolean");
        }
        return Kline.builder()
                .symbol(symbol.toUpperCase(Locale.ROOT))
                .timeframe(timeframe)
                .openTime(integer(k, "t"))
                .closeTime(integer(k, "T"))
                .open(decimal(k, "o"))
                .high(decimal(k, "h"))
                .low(decimal(k, "l"))
                .close(decimal(k, "c"))
                .volume(decimal(k, "v"))
                .quoteVolume(decimal(k, "q"))
                .tradeCount(integer(k, "n"))
                .takerBuyBaseVolume(decimal(k, "V"))
                .takerBuyQuoteVolume(decimal(k, "Q"))
                .isFinal(isFinal.booleanValue())
                .build();
    }

    private String timeframeFromStream(String stream) {
        int idx = stream.indexOf(KLINE_STREAM_MARKER);
        if (idx < 0 || idx + KLINE_STREAM_MARKER.length() >= stream.length()) {
            throw new MalformedFrameException("Cannot derive timeframe from stream '" + stream + "'");
        }
        return stream.substring(idx + KLINE_STREAM_MARKER.length());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }

    private static long integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new MalformedFrameException("Field " + field + " must be an integer");
        }
        return value.asLong();
    }

    // the exchange sends prices and volumes as decimal strings
    private static double decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedFrameException("Missing field " + field);
        }
        double parsed;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedFrameException("Field " + field + " is not a number: " + value.asText(), e);
            }
        } else {
            throw new MalformedFrameException("Field " + field + " has unexpected type " + value.getNodeType());
        }
        if (!Double.isFinite(parsed) || parsed < 0) {
            throw new MalformedFrameException("Field " + field + " out of range: " + parsed);
        }
        return parsed;
    }
}
