package com.example.roster.catalog;

import java.util.EnumMap;
import java.util.Map;

/**
 * Legal limits applied to every roster.
 */
public record ConstraintParameters(double minShiftHours,
                                   double maxShiftHours,
                                   double minRestHours,
                                   double dailyHourCap,
                                   Map<EmploymentClass, Double> weeklyHourCapByClass,
                                   int maxManagersPerStorePerDay) {

    public static final double DEFAULT_WEEKLY_CAP = 38.0;

    public ConstraintParameters {
        if (minShiftHours <= 0 || maxShiftHours < minShiftHours) {
            throw new IllegalArgumentException("Shift length bounds are invalid: " + minShiftHours + ".." + maxShiftHours);
        }
        EnumMap<EmploymentClass, Double> caps = new EnumMap<>(EmploymentClass.class);
        if (weeklyHourCapByClass != null) {
            caps.putAll(weeklyHourCapByClass);
        }
        weeklyHourCapByClass = Map.copyOf(caps);
    }

    public static ConstraintParameters defaults() {
        return new ConstraintParameters(3.0, 12.0, 10.0, 12.0,
                Map.of(EmploymentClass.FULL_TIME, 38.0,
                        EmploymentClass.PART_TIME, 30.0,
                        EmploymentClass.CASUAL, 40.0),
                10);
    }

    public double weeklyCapFor(EmploymentClass employmentClass) {
        Double cap = weeklyHourCapByClass.get(employmentClass);
        return cap == null ? DEFAULT_WEEKLY_CAP : cap;
    }

    public double clampShiftHours(double hours) {
        return Math.max(minShiftHours, Math.min(maxShiftHours, hours));
    }
}
