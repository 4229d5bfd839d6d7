package com.example.roster.catalog;

import java.util.Optional;

/**
 * Catalog entry for a shift code.
 *
 * @param code          short identifier such as {@code 1F}
 * @param timeRange     raw window text from the catalog, e.g. {@code "06:00 - 15:00"} or {@code "TBD"}
 * @param durationHours paid hours, 0 when the catalog does not say
 * @param name          display name
 */
public record ShiftDefinition(String code, String timeRange, double durationHours, String name) {

    public static final String UNKNOWN_TIME = "TBD";

    public static ShiftDefinition unknown(String code) {
        return new ShiftDefinition(code, UNKNOWN_TIME, 0, code);
    }

    public Optional<TimeRange> parsedTime() {
        return TimeRange.parse(timeRange);
    }
}
