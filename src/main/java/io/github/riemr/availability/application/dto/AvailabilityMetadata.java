package io.github.riemr.availability.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AvailabilityMetadata {
    long queryTimeMs;
    /** Monthly view only. */
    Integer totalDaysChecked;
    /** Daily view only. */
    Integer totalSlotsChecked;
    ResourcesChecked resourcesChecked;
    ConflictCounts conflictsFound;
    boolean cacheHit;
}
