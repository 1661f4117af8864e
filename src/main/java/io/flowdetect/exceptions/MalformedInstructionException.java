package io.flowdetect.exceptions;

/**
 * Thrown for unsupported instructions, multi-qubit collapsing operations,
 * malformed REPEAT counts and circuits that break the moment structure.
 */
public class MalformedInstructionException extends FlowDetectException {

    public MalformedInstructionException(String message) {
        super(message);
    }

    public MalformedInstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
