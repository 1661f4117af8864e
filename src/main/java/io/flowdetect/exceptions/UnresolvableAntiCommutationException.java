package io.flowdetect.exceptions;

/**
 * Thrown when an operator cannot be collapsed because it anticommutes with
 * one of its collapsing operations and no commuting combination exists.
 */
public class UnresolvableAntiCommutationException extends FlowDetectException {

    public UnresolvableAntiCommutationException(String message) {
        super(message);
    }
}
