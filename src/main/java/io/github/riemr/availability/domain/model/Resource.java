package io.github.riemr.availability.domain.model;

import lombok.Value;

@Value
public class Resource {
    long id;
    ResourceType type;
    ResourceAvailabilityPattern availability;
}
