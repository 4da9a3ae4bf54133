package io.github.riemr.availability.application.dto;

import lombok.Value;

@Value
public class DriverRequirement {
    int driversNeeded;
    Reason reason;

    public enum Reason {
        DIY_ALL_UNITS,
        FULL_SERVICE_EXTRA_UNITS,
        FULL_SERVICE_NO_MOVER
    }
}
