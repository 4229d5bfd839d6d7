package com.example.roster.report;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.StoreProfile;
import com.example.roster.schedule.Assignment;
import com.example.roster.schedule.RosterInput;
import com.example.roster.schedule.Schedule;
import com.example.roster.worker.Availability;
import com.example.roster.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.*;

/**
 * 最終チェック。割り当て済みのシフトだけでなく、従業員が出した希望枠すべてを対象に集計する。
 */
@Component
public class FinalCoverageReporter {

    private static final Logger logger = LoggerFactory.getLogger(FinalCoverageReporter.class);

    static final int MINOR_UNFILLED_LIMIT = 5;
    static final int MINOR_UNDERSTAFFED_LIMIT = 3;

    static final String SUMMARY_COMPLETE = "Roster is complete and meets all requirements.";
    static final String SUMMARY_MINOR = "Roster is mostly complete but has minor issues that need review.";
    static final String SUMMARY_GAPS = "Roster has significant gaps that need attention.";
    static final String OPTIMAL = "Roster is optimal. No changes needed.";

    public CoverageReport report(Schedule schedule, RosterInput input) {
        List<AvailabilityCheck> availability = checkAvailability(schedule, input);
        List<StaffingCheck> staffing = checkStaffing(schedule, input.catalog());

        int total = availability.size();
        int filled = count(availability, AvailabilityCheck.Status.FILLED);
        int unfilled = count(availability, AvailabilityCheck.Status.UNFILLED);
        int mismatched = count(availability, AvailabilityCheck.Status.MISMATCH);
        int understaffed = (int) staffing.stream().filter(StaffingCheck::isUnderstaffed).count();

        RosterStatus status;
        String summary;
        if (unfilled == 0 && mismatched == 0 && understaffed == 0) {
            status = RosterStatus.APPROVED;
            summary = SUMMARY_COMPLETE;
        } else if (unfilled <= MINOR_UNFILLED_LIMIT && understaffed <= MINOR_UNDERSTAFFED_LIMIT) {
            status = RosterStatus.NEEDS_REVIEW;
            summary = SUMMARY_MINOR;
        } else {
            status = RosterStatus.NEEDS_REVIEW;
            summary = SUMMARY_GAPS;
        }

        List<String> recommendations = new ArrayList<>();
        if (unfilled > 0) {
            recommendations.add("Fill " + unfilled + " unfilled availability slots to maximize employee utilization.");
        }
        if (mismatched > 0) {
            recommendations.add("Review " + mismatched + " shift assignments that don't match employee availability preferences.");
        }
        if (understaffed > 0) {
            recommendations.add("Address " + understaffed + " understaffed stations to meet operational requirements.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add(OPTIMAL);
        }

        double coverage = coveragePercent(filled, total);
        logger.info("Final check: {} ({}/{} slots filled, {}%, {} understaffed)", status.getCode(), filled, total, coverage, understaffed);
        return new CoverageReport(status, total, filled, unfilled, mismatched, coverage, understaffed,
                availability, staffing, summary, recommendations);
    }

    /**
     * Filled share of offered slots in percent, two decimals. Zero when nothing was offered.
     */
    public double coverage(Schedule schedule, RosterInput input) {
        List<AvailabilityCheck> checks = checkAvailability(schedule, input);
        return coveragePercent(count(checks, AvailabilityCheck.Status.FILLED), checks.size());
    }

    static double coveragePercent(int filled, int total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(filled * 100.0 / total).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    List<AvailabilityCheck> checkAvailability(Schedule schedule, RosterInput input) {
        Map<String, Map<LocalDate, Assignment>> byWorker = new HashMap<>();
        for (Assignment a : schedule.assignments()) {
            byWorker.computeIfAbsent(a.workerId(), k -> new HashMap<>()).putIfAbsent(a.date(), a);
        }
        ConstraintCatalog catalog = input.catalog();
        List<AvailabilityCheck> checks = new ArrayList<>();
        for (Worker worker : input.workers()) {
            for (Availability.Slot slot : worker.availability().slots()) {
                if (slot.dayIndex() < 1 || slot.dayIndex() > input.horizon().days()) {
                    continue;
                }
                LocalDate date = input.horizon().dateOf(slot.dayIndex());
                Assignment assigned = byWorker.getOrDefault(worker.id(), Map.of()).get(date);
                AvailabilityCheck.Status status;
                if (assigned == null) {
                    status = AvailabilityCheck.Status.UNFILLED;
                } else if (assigned.shiftCode().equalsIgnoreCase(slot.code()) || catalog.isFlexible(assigned.shiftCode())) {
                    status = AvailabilityCheck.Status.FILLED;
                } else {
                    status = AvailabilityCheck.Status.MISMATCH;
                }
                checks.add(new AvailabilityCheck(worker.id(), worker.name(), date, slot.code(),
                        assigned == null ? null : assigned.shiftCode(), status));
            }
        }
        return checks;
    }

    List<StaffingCheck> checkStaffing(Schedule schedule, ConstraintCatalog catalog) {
        Map<String, Integer> counts = new HashMap<>();
        Map<String, SortedSet<LocalDate>> datesByStore = new HashMap<>();
        for (Assignment a : schedule.assignments()) {
            if (a.store() == null) {
                continue;
            }
            String store = a.store().toLowerCase(Locale.ROOT);
            datesByStore.computeIfAbsent(store, k -> new TreeSet<>()).add(a.date());
            counts.merge(slotKey(store, a.date(), a.station()), 1, Integer::sum);
        }
        List<StaffingCheck> checks = new ArrayList<>();
        for (StoreProfile store : catalog.stores()) {
            String storeKey = store.name().toLowerCase(Locale.ROOT);
            for (LocalDate date : datesByStore.getOrDefault(storeKey, new TreeSet<>())) {
                for (String station : store.stationMinimums().keySet()) {
                    int required = store.requiredFor(station);
                    int assigned = counts.getOrDefault(slotKey(storeKey, date, station), 0);
                    boolean met = assigned >= required;
                    String details = "Required: " + required + ", Assigned: " + assigned;
                    if (!met) {
                        details += " (Shortage: " + (required - assigned) + ")";
                    }
                    checks.add(new StaffingCheck(store.name(), date, station, required, assigned,
                            met ? StaffingCheck.Status.MET : StaffingCheck.Status.UNDERSTAFFED, details));
                }
            }
        }
        return checks;
    }

    private static String slotKey(String store, LocalDate date, String station) {
        return store + "|" + date + "|" + (station == null ? "" : station.trim().toLowerCase(Locale.ROOT));
    }

    private static int count(List<AvailabilityCheck> checks, AvailabilityCheck.Status status) {
        return (int) checks.stream().filter(c -> c.status() == status).count();
    }
}
