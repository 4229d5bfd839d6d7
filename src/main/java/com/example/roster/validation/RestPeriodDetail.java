package com.example.roster.validation;

import java.time.LocalDate;

/**
 * @param previousDate date of the shift the rest gap is measured from
 */
public record RestPeriodDetail(LocalDate previousDate, double observedHours, double requiredHours)
        implements ViolationDetail {
}
