package io.flowdetect.exceptions;

/**
 * Thrown when boundary stabilizers defined on different collapsing operations
 * (or propagated in different directions) are merged.
 */
public class IncompatibleBoundaryMergeException extends FlowDetectException {

    public IncompatibleBoundaryMergeException(String message) {
        super(message);
    }
}
