package com.example.roster.catalog;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Set;

/**
 * A busy period for a store. An empty day set means the window applies every day.
 */
public record PeakWindow(Set<DayOfWeek> days, LocalTime start, LocalTime end) {

    public PeakWindow {
        days = days == null ? Set.of() : Set.copyOf(days);
    }

    public boolean appliesTo(DayOfWeek day) {
        return days.isEmpty() || days.contains(day);
    }

    public boolean overlaps(DayOfWeek day, TimeRange shift) {
        return appliesTo(day) && shift.overlaps(start, end);
    }
}
