package io.github.riemr.availability.application.exception;

/**
 * Roster, booking or task data could not be read, or came back in an unexpected shape.
 * Callers must not treat this as "no availability".
 */
public class UpstreamDataException extends RuntimeException {
    public UpstreamDataException(String message) {
        super(message);
    }

    public UpstreamDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
