package com.alphatransformer.backend.exception;

/**
 * The streaming transport could not be opened, or an open transport was lost.
 */
public class StreamConnectionException extends RuntimeException {

    public StreamConnectionException(String message) {
        super(message);
    }

    public StreamConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
