package com.example.roster.engine;

import com.example.roster.catalog.StoreProfile;
import com.example.roster.worker.Worker;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Puts workers whose home station is short-staffed at any store ahead of the rest.
 * Order inside each group is kept as given.
 */
public final class StaffingPriority {

    private StaffingPriority() {
    }

    public static List<Worker> order(List<Worker> workers, List<StoreProfile> stores, StaffingTally tally, LocalDate date) {
        List<Worker> first = new ArrayList<>();
        List<Worker> rest = new ArrayList<>();
        for (Worker w : workers) {
            if (isDeficient(w.station(), stores, tally, date)) {
                first.add(w);
            } else {
                rest.add(w);
            }
        }
        first.addAll(rest);
        return first;
    }

    static boolean isDeficient(String station, List<StoreProfile> stores, StaffingTally tally, LocalDate date) {
        for (StoreProfile store : stores) {
            int required = store.requiredFor(station);
            if (required - tally.assigned(store.name(), date, station) > 0) {
                return true;
            }
        }
        return false;
    }
}
