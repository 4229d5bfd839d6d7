package com.example.roster.engine;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Running headcount per (store, date, station) while a schedule is being built.
 */
public class StaffingTally {

    private final Map<Slot, Integer> counts = new HashMap<>();

    public int assigned(String store, LocalDate date, String station) {
        return counts.getOrDefault(Slot.of(store, date, station), 0);
    }

    public void increment(String store, LocalDate date, String station) {
        counts.merge(Slot.of(store, date, station), 1, Integer::sum);
    }

    private record Slot(String store, LocalDate date, String station) {
        static Slot of(String store, LocalDate date, String station) {
            return new Slot(key(store), date, key(station));
        }

        private static String key(String s) {
            return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
        }
    }
}
