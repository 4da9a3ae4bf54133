package io.github.riemr.availability.domain.model;

public enum ResourceType {
    MOVER,
    DRIVER
}
