package io.github.riemr.availability.application.dto;

import io.github.riemr.availability.application.exception.AvailabilityValidationException;
import io.github.riemr.availability.domain.model.PlanType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyAvailabilityQuery {
    private LocalDate date;
    private PlanType planType;
    private int unitCount;
    /** Appointment being edited; its own bookings do not block the slots. */
    private Long excludeAppointmentId;

    /** Builds a query from raw request values, e.g. {@code of("2025-01-06", "FULL_SERVICE", 2, null)}. */
    public static DailyAvailabilityQuery of(String date, String planType, int unitCount, Long excludeAppointmentId) {
        if (date == null) {
            throw new AvailabilityValidationException("date is required");
        }
        LocalDate parsed;
        try {
            parsed = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new AvailabilityValidationException("Invalid date: " + date);
        }
        return new DailyAvailabilityQuery(parsed, PlanType.fromCode(planType), unitCount, excludeAppointmentId);
    }
}
