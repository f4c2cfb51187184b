package com.alphatransformer.backend.exception;

public class StreamClosedException extends StreamConnectionException {

    public StreamClosedException(String message) {
        super(message);
    }

    public StreamClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
