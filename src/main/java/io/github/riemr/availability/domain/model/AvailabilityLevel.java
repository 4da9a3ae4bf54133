package io.github.riemr.availability.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AvailabilityLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
