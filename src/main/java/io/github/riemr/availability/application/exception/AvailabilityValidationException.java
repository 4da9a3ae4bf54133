package io.github.riemr.availability.application.exception;

/**
 * Malformed availability query (unknown plan type, bad date, unit count below one ...).
 * Raised before the cache or the database is touched.
 */
public class AvailabilityValidationException extends IllegalArgumentException {
    public AvailabilityValidationException(String message) {
        super(message);
    }
}
