package com.example.roster.validation;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.ConstraintParameters;
import com.example.roster.catalog.StoreProfile;
import com.example.roster.catalog.TimeRange;
import com.example.roster.schedule.Assignment;
import com.example.roster.schedule.ManagerPool;
import com.example.roster.schedule.RosterInput;
import com.example.roster.schedule.Schedule;
import com.example.roster.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.*;

/**
 * 完成したシフト表を検査し、違反を列挙する。入力は変更しない。
 * 出力順: 希望 → 責任者 → 勤務時間 → 休息 → 店舗カバー。
 */
@Component
public class RosterValidator {

    private static final Logger logger = LoggerFactory.getLogger(RosterValidator.class);

    public List<Violation> validate(Schedule schedule, RosterInput input, ManagerPool managers) {
        List<Violation> violations = new ArrayList<>();
        violations.addAll(checkAvailability(schedule, input));
        violations.addAll(checkManagerCoverage(schedule, managers));
        violations.addAll(checkShiftLength(schedule, input.catalog().constraints()));
        violations.addAll(checkRestPeriods(schedule, input.catalog().restThresholds().fullMinimum()));
        violations.addAll(checkStoreCoverage(schedule, input.catalog()));
        logger.debug("Validated {} assignments: {} violations", schedule.shiftCount(), violations.size());
        return violations;
    }

    List<Violation> checkAvailability(Schedule schedule, RosterInput input) {
        ConstraintCatalog catalog = input.catalog();
        List<Violation> out = new ArrayList<>();
        for (Assignment a : schedule.assignments()) {
            Optional<String> requested = requestedCode(input, a);
            if (requested.isEmpty()) {
                out.add(new Violation(ViolationKind.AVAILABILITY, Severity.CRITICAL,
                        a.workerId(), a.workerName(), a.date(), a.shiftCode(),
                        String.format("%s is not available on %s but is assigned %s", a.workerName(), a.date(), a.shiftCode()),
                        "Remove the assignment or choose another available employee",
                        new AvailabilityDetail(null, a.shiftCode(), true)));
                continue;
            }
            String wanted = requested.get();
            if (!wanted.equalsIgnoreCase(a.shiftCode())
                    && !catalog.isFlexible(wanted)
                    && !catalog.isFlexible(a.shiftCode())) {
                out.add(new Violation(ViolationKind.AVAILABILITY, Severity.WARNING,
                        a.workerId(), a.workerName(), a.date(), a.shiftCode(),
                        String.format("%s requested %s on %s but is assigned %s", a.workerName(), wanted, a.date(), a.shiftCode()),
                        "Assign the requested shift " + wanted,
                        new AvailabilityDetail(wanted, a.shiftCode(), false)));
            }
        }
        return out;
    }

    private Optional<String> requestedCode(RosterInput input, Assignment a) {
        Optional<Worker> worker = input.worker(a.workerId());
        OptionalInt dayIndex = input.horizon().dayIndexOf(a.date());
        if (worker.isEmpty() || dayIndex.isEmpty()) {
            return Optional.empty();
        }
        return worker.get().availability().requestedCode(dayIndex.getAsInt());
    }

    List<Violation> checkManagerCoverage(Schedule schedule, ManagerPool managers) {
        Map<ShiftGroup, List<Assignment>> groups = new LinkedHashMap<>();
        for (Assignment a : schedule.assignments()) {
            groups.computeIfAbsent(new ShiftGroup(a.date(), a.shiftTime()), k -> new ArrayList<>()).add(a);
        }
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<ShiftGroup, List<Assignment>> e : groups.entrySet()) {
            List<Assignment> rows = e.getValue();
            boolean covered = rows.stream().anyMatch(a -> a.hasManager() && managers.contains(a.managerId()));
            if (!covered) {
                ShiftGroup g = e.getKey();
                out.add(new Violation(ViolationKind.MANAGER_COVERAGE, Severity.CRITICAL,
                        null, null, g.date(), rows.get(0).shiftCode(),
                        String.format("No manager assigned to shift on %s at %s", g.date(), g.shiftTime()),
                        "Assign at least one manager to this shift",
                        new ManagerCoverageDetail(g.shiftTime(), rows.size())));
            }
        }
        return out;
    }

    List<Violation> checkShiftLength(Schedule schedule, ConstraintParameters limits) {
        List<Violation> out = new ArrayList<>();
        for (Assignment a : schedule.assignments()) {
            if (a.hours() < limits.minShiftHours()) {
                out.add(new Violation(ViolationKind.SHIFT_LENGTH, Severity.CRITICAL,
                        a.workerId(), a.workerName(), a.date(), a.shiftCode(),
                        String.format("Shift length %s hours is below minimum %s hours", a.hours(), limits.minShiftHours()),
                        String.format("Increase shift length to at least %s hours", limits.minShiftHours()),
                        new ShiftLengthDetail(a.hours(), limits.minShiftHours(), ShiftLengthDetail.Bound.UNDER)));
            }
            if (a.hours() > limits.maxShiftHours()) {
                out.add(new Violation(ViolationKind.SHIFT_LENGTH, Severity.CRITICAL,
                        a.workerId(), a.workerName(), a.date(), a.shiftCode(),
                        String.format("Shift length %s hours exceeds maximum %s hours", a.hours(), limits.maxShiftHours()),
                        String.format("Reduce shift length to maximum %s hours", limits.maxShiftHours()),
                        new ShiftLengthDetail(a.hours(), limits.maxShiftHours(), ShiftLengthDetail.Bound.OVER)));
            }
        }
        return out;
    }

    List<Violation> checkRestPeriods(Schedule schedule, double minRestHours) {
        Map<String, List<Assignment>> byWorker = new LinkedHashMap<>();
        for (Assignment a : schedule.assignments()) {
            byWorker.computeIfAbsent(a.workerId(), k -> new ArrayList<>()).add(a);
        }
        List<Violation> out = new ArrayList<>();
        for (List<Assignment> shifts : byWorker.values()) {
            List<Assignment> sorted = new ArrayList<>(shifts);
            sorted.sort(Comparator.comparing(Assignment::date).thenComparing(Assignment::shiftTime,
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            for (int i = 0; i + 1 < sorted.size(); i++) {
                Assignment current = sorted.get(i);
                Assignment next = sorted.get(i + 1);
                if (!next.date().equals(current.date().plusDays(1))) {
                    continue;
                }
                Optional<TimeRange> currentTime = current.parsedTime();
                Optional<TimeRange> nextTime = next.parsedTime();
                if (currentTime.isEmpty() || nextTime.isEmpty()) {
                    // 時刻が読めない組は判定しない
                    continue;
                }
                double rest = Duration.between(currentTime.get().endOn(current.date()),
                        nextTime.get().startOn(next.date())).toMinutes() / 60.0;
                if (rest < minRestHours) {
                    out.add(new Violation(ViolationKind.REST_PERIOD, Severity.CRITICAL,
                            next.workerId(), next.workerName(), next.date(), next.shiftCode(),
                            String.format("Employee %s has only %.1f hours rest between shifts (minimum %s required)",
                                    next.workerName(), rest, minRestHours),
                            String.format("Ensure at least %s hours rest between shifts", minRestHours),
                            new RestPeriodDetail(current.date(), rest, minRestHours)));
                }
            }
        }
        return out;
    }

    List<Violation> checkStoreCoverage(Schedule schedule, ConstraintCatalog catalog) {
        Map<String, TreeMap<LocalDate, Set<String>>> stationsByStore = new HashMap<>();
        for (Assignment a : schedule.assignments()) {
            if (a.store() == null) {
                continue;
            }
            stationsByStore.computeIfAbsent(a.store().toLowerCase(Locale.ROOT), k -> new TreeMap<>())
                    .computeIfAbsent(a.date(), k -> new HashSet<>())
                    .add(a.station() == null ? "" : a.station().toLowerCase(Locale.ROOT));
        }
        List<Violation> out = new ArrayList<>();
        for (StoreProfile store : catalog.stores()) {
            TreeMap<LocalDate, Set<String>> byDate = stationsByStore.get(store.name().toLowerCase(Locale.ROOT));
            if (byDate == null) {
                continue;
            }
            for (Map.Entry<LocalDate, Set<String>> e : byDate.entrySet()) {
                List<String> missing = store.stationMinimums().keySet().stream()
                        .filter(store::requires)
                        .filter(station -> !e.getValue().contains(station.toLowerCase(Locale.ROOT)))
                        .toList();
                if (!missing.isEmpty()) {
                    String joined = String.join(", ", missing);
                    out.add(new Violation(ViolationKind.STORE_COVERAGE, Severity.WARNING,
                            null, null, e.getKey(), null,
                            String.format("Store %s missing coverage for stations: %s on %s", store.name(), joined, e.getKey()),
                            String.format("Assign employees to cover %s stations", joined),
                            new StoreCoverageDetail(store.name(), missing)));
                }
            }
        }
        return out;
    }

    private record ShiftGroup(LocalDate date, String shiftTime) {
    }
}
