package com.alphatransformer.backend.service.marketdata;

/**
 * An open duplex stream. {@link #receive()} blocks until the next frame arrives and throws
 * {@link com.alphatransformer.backend.exception.StreamClosedException} once the stream is closed,
 * including when {@link #close()} is called from another thread.
 */
public interface KlineStreamConnection extends AutoCloseable {

    boolean send(String frame);

    String receive() throws InterruptedException;

    @Override
    void close();
}
