package io.github.riemr.availability.application.dto;

import lombok.Value;

@Value
public class ResourceCounts {
    int availableMovers;
    int availableDrivers;
}
