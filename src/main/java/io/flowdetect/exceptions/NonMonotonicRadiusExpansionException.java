package io.flowdetect.exceptions;

/**
 * Thrown when detectors computed with a larger sub-template radius do not
 * include the detectors computed with the smaller one.
 */
public class NonMonotonicRadiusExpansionException extends FlowDetectException {

    private final int radius;

    public NonMonotonicRadiusExpansionException(int radius, String message) {
        super(message);
        this.radius = radius;
    }

    /**
     * The larger of the two radii that were compared.
     */
    public int radius() {
        return radius;
    }
}
