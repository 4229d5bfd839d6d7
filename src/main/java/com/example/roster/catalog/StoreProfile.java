package com.example.roster.catalog;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store with its per-station minimum headcount. A station listed with 0 exists in the store but is optional.
 */
public record StoreProfile(String name,
                           Map<String, Integer> stationMinimums,
                           double trafficWeight,
                           List<PeakWindow> peakWindows) {

    public StoreProfile {
        stationMinimums = Collections.unmodifiableMap(new LinkedHashMap<>(stationMinimums == null ? Map.of() : stationMinimums));
        peakWindows = peakWindows == null ? List.of() : List.copyOf(peakWindows);
    }

    public int requiredFor(String station) {
        if (station == null) {
            return 0;
        }
        for (Map.Entry<String, Integer> e : stationMinimums.entrySet()) {
            if (e.getKey().equalsIgnoreCase(station.trim())) {
                return Math.max(0, e.getValue() == null ? 0 : e.getValue());
            }
        }
        return 0;
    }

    /**
     * True when the store needs at least one person on the station.
     */
    public boolean requires(String station) {
        return requiredFor(station) > 0;
    }

    public boolean isPeak(DayOfWeek day, Optional<TimeRange> shift) {
        if (shift.isEmpty()) {
            return false;
        }
        return peakWindows.stream().anyMatch(p -> p.overlaps(day, shift.get()));
    }
}
