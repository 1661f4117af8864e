package io.flowdetect.exceptions;

/**
 * Thrown when the radius-expansion loop reaches its configured maximum
 * without finding a fixed point.
 */
public class RadiusLimitExceededException extends FlowDetectException {

    public RadiusLimitExceededException(String message) {
        super(message);
    }
}
