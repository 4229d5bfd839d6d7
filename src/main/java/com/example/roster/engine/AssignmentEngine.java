package com.example.roster.engine;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.ConstraintParameters;
import com.example.roster.catalog.ShiftCatalog;
import com.example.roster.catalog.ShiftDefinition;
import com.example.roster.catalog.StoreProfile;
import com.example.roster.catalog.TimeRange;
import com.example.roster.schedule.Assignment;
import com.example.roster.schedule.AssignmentStatus;
import com.example.roster.schedule.ManagerPool;
import com.example.roster.schedule.ManagerPool.Manager;
import com.example.roster.schedule.RosterInput;
import com.example.roster.schedule.Schedule;
import com.example.roster.validation.ShiftLengthDetail;
import com.example.roster.worker.Horizon;
import com.example.roster.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

/**
 * 日付順・従業員順の貪欲法でシフト表を作る。
 * <p>
 * Nothing here throws for an individual slot: every rejected request is written to the {@link SkipLog}.
 * All randomness comes from a generator seeded with {@code baseSeed + iteration}, so the same inputs and
 * iteration always produce the same schedule.
 */
@Component
public class AssignmentEngine {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentEngine.class);

    /** Iteration from which a problematic shift without a usable substitute is dropped. */
    static final int PROBLEMATIC_SKIP_ITERATION = 4;
    /** Iteration from which dates flagged for short rest are left empty. */
    static final int REST_FLAG_SKIP_ITERATION = 3;
    static final double STATION_CEILING_FACTOR = 3.0;
    static final int UNREQUIRED_STATION_CEILING = 10;

    private final long baseSeed;

    public AssignmentEngine(@Value("${roster.iteration.base-seed:42}") long baseSeed) {
        this.baseSeed = baseSeed;
    }

    public long seedFor(int iteration) {
        return baseSeed + iteration;
    }

    public Schedule generate(RosterInput input, ManagerPool managers, IterationMemory memory, int iteration, SkipLog skips) {
        ConstraintCatalog catalog = input.catalog();
        Horizon horizon = input.horizon();
        Random random = new Random(seedFor(iteration));

        List<Worker> workers = new ArrayList<>(input.workers());
        Collections.shuffle(workers, random);

        GenerationState state = new GenerationState(
                new StoreRouter(catalog.stores(), iteration, random),
                new ManagerAllocator(managers, catalog.constraints().maxManagersPerStorePerDay(), random));
        double restThreshold = catalog.restThresholds().threshold(iteration);

        for (int dayIndex = 1; dayIndex <= horizon.days(); dayIndex++) {
            LocalDate date = horizon.dateOf(dayIndex);
            List<Worker> ordered = StaffingPriority.order(workers, catalog.stores(), state.tally, date);
            for (Worker worker : ordered) {
                Optional<String> requested = worker.availability().requestedCode(dayIndex);
                if (requested.isEmpty()) {
                    continue;
                }
                resolveCode(worker, date, requested.get(), memory, iteration, skips)
                        .ifPresent(code -> place(worker, date, code, catalog, memory, iteration, restThreshold, state, skips));
            }
        }

        Schedule schedule = new Schedule(horizon.startDate(), horizon.endDate(), state.assignments);
        logger.info("Iteration {}: generated {} assignments ({} hours), {} skipped",
                iteration, schedule.shiftCount(), schedule.totalHours(), skips.size());
        return schedule;
    }

    /**
     * Applies what earlier iterations learned to the requested code. Empty means the slot stays open.
     */
    Optional<String> resolveCode(Worker worker, LocalDate date, String requested, IterationMemory memory,
                                 int iteration, SkipLog skips) {
        String workerId = worker.id();
        if (memory.isBlacklisted(workerId, date)) {
            skips.record(workerId, date, requested, SkipReason.BLACKLISTED, "unavailable in an earlier iteration");
            return Optional.empty();
        }
        Optional<String> preferred = memory.preferredCode(workerId, date);
        if (memory.isProblematic(workerId, date, requested)) {
            if (preferred.isPresent() && preferred.get().equalsIgnoreCase(requested)) {
                return preferred;
            }
            if (iteration >= PROBLEMATIC_SKIP_ITERATION) {
                skips.record(workerId, date, requested, SkipReason.PROBLEMATIC_NO_FIX, "no usable substitute");
                return Optional.empty();
            }
            return Optional.of(requested);
        }
        if (preferred.isPresent() && preferred.get().equalsIgnoreCase(requested)) {
            return preferred;
        }
        return Optional.of(requested);
    }

    double resolveHours(String workerId, LocalDate date, String code, ConstraintCatalog catalog, IterationMemory memory) {
        ConstraintParameters limits = catalog.constraints();
        double hours = catalog.shifts().resolveDurationHours(code, limits.minShiftHours());
        Optional<IterationMemory.ShiftLengthIssue> issue = memory.shiftLengthIssue(workerId, date);
        if (issue.isPresent()) {
            hours = issue.get().bound() == ShiftLengthDetail.Bound.UNDER ? limits.minShiftHours() : limits.maxShiftHours();
        }
        return limits.clampShiftHours(hours);
    }

    private void place(Worker worker, LocalDate date, String code, ConstraintCatalog catalog, IterationMemory memory,
                       int iteration, double restThreshold, GenerationState state, SkipLog skips) {
        String workerId = worker.id();
        ConstraintParameters limits = catalog.constraints();
        if (state.hasShift(workerId, date)) {
            skips.record(workerId, date, code, SkipReason.ALREADY_ASSIGNED, "one shift per worker and date");
            return;
        }
        if (iteration >= REST_FLAG_SKIP_ITERATION && memory.isRestFlagged(workerId, date)) {
            skips.record(workerId, date, code, SkipReason.REST_FLAGGED, "short rest in an earlier iteration");
            return;
        }

        ShiftDefinition definition = catalog.shifts().resolve(code);
        double hours = resolveHours(workerId, date, code, catalog, memory);

        double dayTotal = state.dailyHours(workerId, date) + hours;
        if (dayTotal > limits.dailyHourCap()) {
            skips.record(workerId, date, code, SkipReason.DAILY_CAP,
                    String.format("%.1fh would exceed the daily cap of %.1fh", dayTotal, limits.dailyHourCap()));
            return;
        }
        double weekCap = limits.weeklyCapFor(worker.employmentClass());
        double weekTotal = state.weeklyHours(workerId, date) + hours;
        if (weekTotal > weekCap) {
            skips.record(workerId, date, code, SkipReason.WEEKLY_CAP,
                    String.format("%.1fh would exceed the weekly cap of %.1fh", weekTotal, weekCap));
            return;
        }

        Optional<TimeRange> time = definition.parsedTime();
        OptionalDouble rest = state.restBefore(workerId, date, time);
        if (rest.isPresent() && rest.getAsDouble() < restThreshold) {
            skips.record(workerId, date, code, SkipReason.REST_PERIOD,
                    String.format("%.1fh rest, %.1fh required", rest.getAsDouble(), restThreshold));
            return;
        }

        String station = worker.station();
        DayOfWeek day = date.getDayOfWeek();
        Optional<StoreProfile> routed = state.router.route(station, day, time);
        String storeName = routed.map(StoreProfile::name).orElse(null);
        if (routed.isPresent() && !hasStationRoom(routed.get(), date, station, state.tally)) {
            skips.record(workerId, date, code, SkipReason.STATION_CAPACITY,
                    String.format("%s at %s is full while another station is short", station, storeName));
            return;
        }

        Optional<Manager> manager = storeName == null ? Optional.empty() : state.managers.allocate(storeName, date);
        Assignment assignment = new Assignment(
                date,
                Assignment.weekdayName(date),
                workerId,
                worker.name(),
                worker.employmentClass(),
                ShiftCatalog.normalize(code),
                definition.timeRange(),
                hours,
                storeName,
                station,
                manager.map(Manager::id).orElse(null),
                manager.map(Manager::name).orElse(null),
                AssignmentStatus.forDate(date));
        state.record(assignment, time);
    }

    /**
     * A station may run well past its minimum so that every offered slot can be used; it is only closed
     * once at its ceiling while a sibling station is below half of its own minimum.
     */
    boolean hasStationRoom(StoreProfile store, LocalDate date, String station, StaffingTally tally) {
        int required = store.requiredFor(station);
        int ceiling = required > 0 ? (int) Math.round(required * STATION_CEILING_FACTOR) : UNREQUIRED_STATION_CEILING;
        if (tally.assigned(store.name(), date, station) < ceiling) {
            return true;
        }
        for (Map.Entry<String, Integer> e : store.stationMinimums().entrySet()) {
            String sibling = e.getKey();
            int min = store.requiredFor(sibling);
            if (sibling.equalsIgnoreCase(station) || min <= 0) {
                continue;
            }
            if (tally.assigned(store.name(), date, sibling) < min / 2.0) {
                return false;
            }
        }
        return true;
    }

    private static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /**
     * Counters for one generated schedule. Discarded when generation finishes.
     */
    private static final class GenerationState {
        final StoreRouter router;
        final ManagerAllocator managers;
        final StaffingTally tally = new StaffingTally();
        final List<Assignment> assignments = new ArrayList<>();
        final Map<String, Map<LocalDate, Double>> hoursByDay = new HashMap<>();
        final Map<String, Map<LocalDate, Double>> hoursByWeek = new HashMap<>();
        final Map<String, Map<LocalDate, Optional<TimeRange>>> timesByWorker = new HashMap<>();

        GenerationState(StoreRouter router, ManagerAllocator managers) {
            this.router = router;
            this.managers = managers;
        }

        boolean hasShift(String workerId, LocalDate date) {
            return hoursByDay.getOrDefault(workerId, Map.of()).containsKey(date);
        }

        double dailyHours(String workerId, LocalDate date) {
            return hoursByDay.getOrDefault(workerId, Map.of()).getOrDefault(date, 0.0);
        }

        double weeklyHours(String workerId, LocalDate date) {
            return hoursByWeek.getOrDefault(workerId, Map.of()).getOrDefault(weekStart(date), 0.0);
        }

        /**
         * Hours between the end of the worker's shift on the previous day and the start of the candidate.
         * Empty when either time is unknown or the worker did not work the day before.
         */
        OptionalDouble restBefore(String workerId, LocalDate date, Optional<TimeRange> candidate) {
            Map<LocalDate, Optional<TimeRange>> times = timesByWorker.get(workerId);
            if (times == null || candidate.isEmpty()) {
                return OptionalDouble.empty();
            }
            LocalDate previousDate = date.minusDays(1);
            Optional<TimeRange> previous = times.getOrDefault(previousDate, Optional.empty());
            if (previous.isEmpty()) {
                return OptionalDouble.empty();
            }
            Duration gap = Duration.between(previous.get().endOn(previousDate), candidate.get().startOn(date));
            return OptionalDouble.of(gap.toMinutes() / 60.0);
        }

        void record(Assignment a, Optional<TimeRange> time) {
            assignments.add(a);
            hoursByDay.computeIfAbsent(a.workerId(), k -> new HashMap<>()).merge(a.date(), a.hours(), Double::sum);
            hoursByWeek.computeIfAbsent(a.workerId(), k -> new HashMap<>()).merge(weekStart(a.date()), a.hours(), Double::sum);
            timesByWorker.computeIfAbsent(a.workerId(), k -> new HashMap<>()).put(a.date(), time);
            if (a.store() != null) {
                tally.increment(a.store(), a.date(), a.station());
            }
        }
    }
}
