package com.alphatransformer.backend.exception;

/**
 * A single inbound frame could not be understood. Recoverable: the frame is dropped.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
