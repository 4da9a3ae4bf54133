package io.github.riemr.availability.application.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class MonthlyAvailabilityResponse {
    List<MonthlyAvailabilityDate> dates;
    AvailabilityMetadata metadata;

    public MonthlyAvailabilityResponse markCacheHit() {
        return toBuilder().metadata(metadata.toBuilder().cacheHit(true).build()).build();
    }
}
