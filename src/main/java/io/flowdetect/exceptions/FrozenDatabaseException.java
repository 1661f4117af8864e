package io.flowdetect.exceptions;

/**
 * Thrown when a frozen detector database is mutated.
 */
public class FrozenDatabaseException extends FlowDetectException {

    public FrozenDatabaseException(String message) {
        super(message);
    }
}
