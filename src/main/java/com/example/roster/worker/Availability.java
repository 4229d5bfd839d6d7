package com.example.roster.worker;

import com.example.roster.catalog.ShiftCatalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Requested shift code per horizon day (1-based). Blank, "/" and "NA" mean the worker is not available.
 */
public final class Availability {

    private static final Set<String> UNAVAILABLE_MARKERS = Set.of("", "/", "NA");

    private final Map<Integer, String> requested;

    public Availability(Map<Integer, String> byDay) {
        TreeMap<Integer, String> map = new TreeMap<>();
        if (byDay != null) {
            byDay.forEach((day, code) -> {
                if (day != null && !isUnavailableMarker(code)) {
                    map.put(day, ShiftCatalog.normalize(code));
                }
            });
        }
        this.requested = Collections.unmodifiableMap(map);
    }

    public static Availability none() {
        return new Availability(Map.of());
    }

    public static boolean isUnavailableMarker(String code) {
        return code == null || UNAVAILABLE_MARKERS.contains(code.trim().toUpperCase(Locale.ROOT));
    }

    public Optional<String> requestedCode(int dayIndex) {
        return Optional.ofNullable(requested.get(dayIndex));
    }

    public boolean isAvailable(int dayIndex) {
        return requested.containsKey(dayIndex);
    }

    /**
     * Requested slots in day order.
     */
    public List<Slot> slots() {
        List<Slot> list = new ArrayList<>(requested.size());
        requested.forEach((day, code) -> list.add(new Slot(day, code)));
        return list;
    }

    public Map<Integer, String> asMap() {
        return requested;
    }

    public record Slot(int dayIndex, String code) {
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Availability other && requested.equals(other.requested);
    }

    @Override
    public int hashCode() {
        return requested.hashCode();
    }

    @Override
    public String toString() {
        return "Availability" + requested;
    }
}
