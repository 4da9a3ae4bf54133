package io.github.riemr.availability.application.util;

import io.github.riemr.availability.application.dto.DriverRequirement;
import io.github.riemr.availability.domain.model.PlanType;

import java.util.Objects;

/**
 * Drivers needed for an appointment.
 * <ul>
 *   <li>DIY: one driver per unit</li>
 *   <li>FULL_SERVICE with a mover: the mover covers the first unit, one driver per extra unit</li>
 *   <li>FULL_SERVICE without a mover: same as DIY</li>
 * </ul>
 */
public final class DriverRequirementCalculator {
    private static final int UNITS_COVERED_BY_MOVER = 1;

    private DriverRequirementCalculator() {}

    public static DriverRequirement calculateDriverRequirement(PlanType planType, int unitCount, boolean moverAvailable) {
        Objects.requireNonNull(planType, "planType");
        if (unitCount < 0) throw new IllegalArgumentException("unitCount must not be negative: " + unitCount);

        if (planType == PlanType.DIY) {
            return new DriverRequirement(unitCount, DriverRequirement.Reason.DIY_ALL_UNITS);
        }
        if (!moverAvailable) {
            return new DriverRequirement(unitCount, DriverRequirement.Reason.FULL_SERVICE_NO_MOVER);
        }
        return new DriverRequirement(Math.max(0, unitCount - UNITS_COVERED_BY_MOVER),
                DriverRequirement.Reason.FULL_SERVICE_EXTRA_UNITS);
    }
}
