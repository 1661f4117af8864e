package io.flowdetect.exceptions;

/**
 * Root of every error raised by the detector engine.
 */
public class FlowDetectException extends RuntimeException {

    public FlowDetectException(String message) {
        super(message);
    }

    public FlowDetectException(String message, Throwable cause) {
        super(message, cause);
    }
}
