package io.github.riemr.availability.domain.model;

import io.github.riemr.availability.application.exception.AvailabilityValidationException;

import java.util.Locale;

/**
 * Service plan requested by the customer.
 * DIY: the customer loads, every unit needs its own driver.
 * FULL_SERVICE: a mover handles loading, which frees one driver.
 */
public enum PlanType {
    DIY,
    FULL_SERVICE;

    public boolean requiresMover() {
        return this == FULL_SERVICE;
    }

    public int requiredMovers() {
        return requiresMover() ? 1 : 0;
    }

    public static PlanType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new AvailabilityValidationException("planType is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return PlanType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new AvailabilityValidationException("Unknown planType: " + code);
        }
    }
}
