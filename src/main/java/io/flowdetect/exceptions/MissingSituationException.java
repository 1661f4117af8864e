package io.flowdetect.exceptions;

/**
 * Thrown by a database-only lookup when the requested situation is not cached.
 */
public class MissingSituationException extends UnresolvableAntiCommutationException {

    public MissingSituationException(String message) {
        super(message);
    }
}
