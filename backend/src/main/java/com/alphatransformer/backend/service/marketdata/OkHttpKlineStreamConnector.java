package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.config.MarketDataProperties;
import com.alphatransformer.backend.exception.StreamConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class OkHttpKlineStreamConnector implements KlineStreamConnector {

    private final OkHttpClient streamHttpClient;
    private final MarketDataProperties properties;

    @Override
    public KlineStreamConnection connect(String url) {
        long timeoutMs = properties.getStream().getConnectTimeoutMs();
        Request request = new Request.Builder().url(url).build();
        OkHttpKlineStreamConnection connection = new OkHttpKlineStreamConnection();
        WebSocket webSocket = streamHttpClient.newWebSocket(request, connection);
        connection.attach(webSocket);
        try {
            if (connection.awaitOpen(timeoutMs)) {
                return connection;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.close();
            throw new StreamConnectionException("Interrupted while connecting to " + url, e);
        }
        connection.close();
        Throwable failure = connection.failure();
        if (failure != null) {
            throw new StreamConnectionException("Unable to connect to " + url + ": " + failure.getMessage(), failure);
        }
        throw new StreamConnectionException("Unable to connect to " + url + " within " + timeoutMs + " ms");
    }
}
