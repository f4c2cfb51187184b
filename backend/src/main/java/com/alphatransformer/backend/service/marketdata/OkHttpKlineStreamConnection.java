package com.alphatransformer.backend.service.marketdata;

import com.alphatransformer.backend.exception.StreamClosedException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Adapts OkHttp's callback WebSocket to the blocking {@link KlineStreamConnection} contract.
 * Inbound frames are queued; closing enqueues a marker that every later receive observes.
 */
@Slf4j
class OkHttpKlineStreamConnection extends WebSocketListener implements KlineStreamConnection {

    private final BlockingQueue<Inbound> frames = new LinkedBlockingQueue<>();
    private final CountDownLatch opened = new CountDownLatch(1);
    private volatile WebSocket webSocket;
    private volatile Throwable failure;
    private volatile String closeReason;

    void attach(WebSocket webSocket) {
        this.webSocket = webSocket;
    }

    boolean awaitOpen(long timeoutMs) throws InterruptedException {
        return opened.await(timeoutMs, TimeUnit.MILLISECONDS) && failure == null && closeReason == null;
    }

    Throwable failure() {
        return failure;
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        log.info("Kline stream open url={}", webSocket.request().url());
        opened.countDown();
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        frames.offer(Inbound.frame(text));
    }

    @Override
    public void onMessage(WebSocket webSocket, ByteString bytes) {
        onMessage(webSocket, bytes.utf8());
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
        webSocket.close(code, reason);
        markClosed("closing code=" + code + " reason=" + reason);
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
        markClosed("closed code=" + code + " reason=" + reason);
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        log.warn("Kline stream failure: {}", t.getMessage());
        failure = t;
        markClosed("failure: " + t.getMessage());
    }

    @Override
    public boolean send(String frame) {
        WebSocket socket = webSocket;
        return socket != null && closeReason == null && socket.send(frame);
    }

    @Override
    public String receive() throws InterruptedException {
        Inbound inbound = frames.take();
        if (inbound.endOfStream()) {
            // keep the marker for any later receive
            frames.offer(inbound);
            throw new StreamClosedException("Kline stream " + closeReason, failure);
        }
        return inbound.text();
    }

    @Override
    public void close() {
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.cancel();
        }
        markClosed("closed locally");
    }

    private void markClosed(String reason) {
        if (closeReason == null) {
            closeReason = reason;
            frames.offer(Inbound.END_OF_STREAM);
        }
        opened.countDown();
    }

    private record Inbound(String text, boolean endOfStream) {

        static final Inbound END_OF_STREAM = new Inbound(null, true);

        static Inbound frame(String text) {
            return new Inbound(text, false);
        }
    }
}
