package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.domain.model.PlanType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyAvailabilityQuery {
    private int year;
    /** 1..12 */
    private int month;
    private PlanType planType;
    private int unitCount;
}
