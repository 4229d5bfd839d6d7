package com.example.roster.schedule;

import com.example.roster.catalog.EmploymentClass;
import com.example.roster.catalog.TimeRange;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * One worker on one shift on one date. Column order follows the roster export.
 */
public record Assignment(LocalDate date,
                         String weekday,
                         String workerId,
                         String workerName,
                         EmploymentClass employmentClass,
                         String shiftCode,
                         String shiftTime,
                         double hours,
                         String store,
                         String station,
                         String managerId,
                         String managerName,
                         AssignmentStatus status) {

    public static String weekdayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    public Optional<TimeRange> parsedTime() {
        return TimeRange.parse(shiftTime);
    }

    public boolean hasManager() {
        return managerId != null && !managerId.isBlank();
    }
}
