package com.example.roster.engine;

import com.example.roster.RosterFixtures;
import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.EmploymentClass;
import com.example.roster.catalog.ShiftDefinition;
import com.example.roster.catalog.StoreProfile;
import com.example.roster.schedule.Assignment;
import com.example.roster.schedule.AssignmentStatus;
import com.example.roster.schedule.ManagerPool;
import com.example.roster.schedule.RosterInput;
import com.example.roster.schedule.Schedule;
import com.example.roster.validation.AvailabilityDetail;
import com.example.roster.validation.RestPeriodDetail;
import com.example.roster.validation.Severity;
import com.example.roster.validation.ShiftLengthDetail;
import com.example.roster.validation.Violation;
import com.example.roster.validation.ViolationKind;
import com.example.roster.worker.Worker;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.roster.RosterFixtures.START;
import static com.example.roster.RosterFixtures.everyDay;
import static com.example.roster.RosterFixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;

class AssignmentEngineTest {

    private final AssignmentEngine engine = new AssignmentEngine(42);
    private final ManagerPool managers = ManagerPool.generate(1, 42);

    private Schedule generate(RosterInput input, IterationMemory memory, int iteration, SkipLog skips) {
        return engine.generate(input, managers, memory, iteration, skips);
    }

    @Test
    void generate_singleRequest_assignsCatalogShiftWithStoreAndManager() {
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "1F"))));

        Schedule schedule = generate(input, new IterationMemory(), 0, new SkipLog());

        assertThat(schedule.assignments()).hasSize(1);
        Assignment a = schedule.assignments().get(0);
        assertThat(a.date()).isEqualTo(START);
        assertThat(a.weekday()).isEqualTo("Monday");
        assertThat(a.shiftCode()).isEqualTo("1F");
        assertThat(a.shiftTime()).isEqualTo("06:00 - 15:00");
        assertThat(a.hours()).isEqualTo(9.0);
        assertThat(a.store()).isIn(RosterFixtures.STORE_1, RosterFixtures.STORE_2);
        assertThat(a.managerId()).startsWith("MGR-");
        assertThat(a.status()).isEqualTo(AssignmentStatus.SCHEDULED);
    }

    @Test
    void generate_weekendDate_isMarkedWeekend() {
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(6, "1F"))));

        Schedule schedule = generate(input, new IterationMemory(), 0, new SkipLog());

        assertThat(schedule.assignments()).singleElement()
                .satisfies(a -> {
                    assertThat(a.weekday()).isEqualTo("Saturday");
                    assertThat(a.status()).isEqualTo(AssignmentStatus.WEEKEND);
                });
    }

    @Test
    void generate_fullDayEveryDay_stopsAtWeeklyCapPerEmploymentClass() {
        List<Worker> workers = List.of(
                worker("FT", "Kitchen", EmploymentClass.FULL_TIME, everyDay("3F")),
                worker("PT", "Kitchen", EmploymentClass.PART_TIME, everyDay("3F")),
                worker("CA", "Kitchen", EmploymentClass.CASUAL, everyDay("3F")));
        SkipLog skips = new SkipLog();

        Schedule schedule = generate(RosterFixtures.input(workers), new IterationMemory(), 0, skips);

        Map<String, Long> counts = schedule.assignments().stream()
                .collect(Collectors.groupingBy(Assignment::workerId, Collectors.counting()));
        // 2週分: 38h → 3回, 30h → 2回, 40h → 3回
        assertThat(counts).containsEntry("FT", 6L).containsEntry("PT", 4L).containsEntry("CA", 6L);
        assertThat(skips.byReason(SkipReason.WEEKLY_CAP)).isNotEmpty()
                .allSatisfy(s -> assertThat(s.detail()).contains("weekly cap"));
    }

    @Test
    void generate_crew_keepsOneShiftPerWorkerDayAndHoursInBounds() {
        Schedule schedule = generate(RosterFixtures.input(RosterFixtures.crew(3)), new IterationMemory(), 0, new SkipLog());

        assertThat(schedule.assignments()).isNotEmpty();
        Set<String> seen = new HashSet<>();
        for (Assignment a : schedule.assignments()) {
            assertThat(seen.add(a.workerId() + "|" + a.date())).as("duplicate %s on %s", a.workerId(), a.date()).isTrue();
            assertThat(a.hours()).isBetween(3.0, 12.0);
            assertThat(a.date()).isBetween(START, START.plusDays(13));
        }
    }

    @Test
    void generate_sameIteration_isDeterministic() {
        RosterInput input = RosterFixtures.input(RosterFixtures.crew(2));

        Schedule first = generate(input, new IterationMemory(), 2, new SkipLog());
        Schedule second = generate(input, new IterationMemory(), 2, new SkipLog());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void generate_crew_limitsDistinctManagersPerStoreAndDate() {
        List<Worker> crew = RosterFixtures.crew(6);
        ManagerPool pool = ManagerPool.generate(crew.size(), 42);

        Schedule schedule = engine.generate(RosterFixtures.input(crew), pool, new IterationMemory(), 0, new SkipLog());

        Map<String, Set<String>> managersByStoreDay = new LinkedHashMap<>();
        for (Assignment a : schedule.assignments()) {
            assertThat(pool.contains(a.managerId())).isTrue();
            managersByStoreDay.computeIfAbsent(a.store() + "|" + a.date(), k -> new HashSet<>()).add(a.managerId());
        }
        assertThat(managersByStoreDay.values()).allSatisfy(ids -> assertThat(ids.size()).isLessThanOrEqualTo(10));
    }

    @Test
    void generate_blacklistedDate_isLeftOpen() {
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "1F", 2, "1F"))));
        IterationMemory memory = new IterationMemory();
        memory.merge(List.of(new Violation(ViolationKind.AVAILABILITY, Severity.CRITICAL, "W1", "Worker W1", START, "1F",
                "not available", "remove", new AvailabilityDetail(null, "1F", true))));
        SkipLog skips = new SkipLog();

        Schedule schedule = generate(input, memory, 1, skips);

        assertThat(schedule.assignments()).extracting(Assignment::date).containsExactly(START.plusDays(1));
        assertThat(skips.byReason(SkipReason.BLACKLISTED)).singleElement()
                .satisfies(s -> assertThat(s.date()).isEqualTo(START));
    }

    @Test
    void generate_shortRestBetweenDays_dependsOnIterationThreshold() {
        List<ShiftDefinition> shifts = new ArrayList<>(RosterFixtures.shiftDefinitions());
        shifts.add(new ShiftDefinition("E", "07:12 - 15:12", 8.0, "Early"));
        ConstraintCatalog catalog = RosterFixtures.catalog(shifts, RosterFixtures.stores());
        // 23:00 → 07:12 = 8.2h
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "2F", 2, "E"))), catalog);

        Schedule early = generate(input, new IterationMemory(), 0, new SkipLog());
        SkipLog skips = new SkipLog();
        Schedule late = generate(input, new IterationMemory(), 5, skips);

        assertThat(early.assignments()).extracting(Assignment::shiftCode).containsExactly("2F", "E");
        assertThat(late.assignments()).extracting(Assignment::shiftCode).containsExactly("2F");
        assertThat(skips.byReason(SkipReason.REST_PERIOD)).singleElement()
                .satisfies(s -> assertThat(s.date()).isEqualTo(START.plusDays(1)));
    }

    @Test
    void generate_unparsableShiftTime_neverBlocksOnRest() {
        List<ShiftDefinition> shifts = new ArrayList<>(RosterFixtures.shiftDefinitions());
        shifts.add(new ShiftDefinition("T", "TBD", 8.0, "To be decided"));
        ConstraintCatalog catalog = RosterFixtures.catalog(shifts, RosterFixtures.stores());
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "2F", 2, "T", 3, "1F"))), catalog);

        Schedule schedule = generate(input, new IterationMemory(), 9, new SkipLog());

        assertThat(schedule.assignments()).hasSize(3);
    }

    @Test
    void generate_repeatedWorkerId_keepsOneShiftPerDate() {
        List<ShiftDefinition> shifts = new ArrayList<>(RosterFixtures.shiftDefinitions());
        shifts.add(new ShiftDefinition("A", "06:00 - 11:00", 5.0, "Morning"));
        shifts.add(new ShiftDefinition("B", "12:00 - 17:00", 5.0, "Afternoon"));
        ConstraintCatalog catalog = RosterFixtures.catalog(shifts, RosterFixtures.stores());
        RosterInput input = RosterFixtures.input(List.of(
                worker("W1", "Kitchen", Map.of(1, "A")),
                worker("W1", "Kitchen", Map.of(1, "B"))), catalog);
        SkipLog skips = new SkipLog();

        Schedule schedule = generate(input, new IterationMemory(), 0, skips);

        assertThat(schedule.assignments()).singleElement()
                .satisfies(a -> assertThat(a.date()).isEqualTo(START));
        assertThat(skips.byReason(SkipReason.ALREADY_ASSIGNED)).singleElement()
                .satisfies(s -> assertThat(s.workerId()).isEqualTo("W1"));
    }

    @Test
    void generate_restIsMeasuredFromPreviousDayOnly() {
        RosterInput input = RosterFixtures.input(List.of(
                worker("W1", "Kitchen", Map.of(1, "2F", 2, "1F")),
                worker("W2", "Kitchen", Map.of(1, "2F", 3, "1F"))));
        SkipLog skips = new SkipLog();

        Schedule schedule = generate(input, new IterationMemory(), 9, skips);

        // 23:00 → 06:00 = 7h
        assertThat(schedule.assignments()).filteredOn(a -> a.workerId().equals("W1"))
                .extracting(Assignment::date).containsExactly(START);
        assertThat(schedule.assignments()).filteredOn(a -> a.workerId().equals("W2"))
                .extracting(Assignment::date).containsExactlyInAnyOrder(START, START.plusDays(2));
        assertThat(skips.byReason(SkipReason.REST_PERIOD)).singleElement()
                .satisfies(s -> assertThat(s.workerId()).isEqualTo("W1"));
    }

    @Test
    void resolveHours_shiftLengthMemory_forcesBound() {
        ConstraintCatalog catalog = RosterFixtures.catalog();
        IterationMemory memory = new IterationMemory();
        memory.merge(List.of(
                shiftLength("W1", START, 2.0, ShiftLengthDetail.Bound.UNDER),
                shiftLength("W2", START, 13.0, ShiftLengthDetail.Bound.OVER)));

        assertThat(engine.resolveHours("W1", START, "1F", catalog, memory)).isEqualTo(3.0);
        assertThat(engine.resolveHours("W2", START, "1F", catalog, memory)).isEqualTo(12.0);
        assertThat(engine.resolveHours("W3", START, "1F", catalog, memory)).isEqualTo(9.0);
    }

    @Test
    void generate_problematicShiftWithoutSubstitute_isDroppedFromFourthIteration() {
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "1F"))));
        IterationMemory memory = new IterationMemory();
        memory.merge(List.of(shiftLength("W1", START, 2.0, ShiftLengthDetail.Bound.UNDER)));

        Schedule before = generate(input, memory, 3, new SkipLog());
        SkipLog skips = new SkipLog();
        Schedule after = generate(input, memory, 4, skips);

        assertThat(before.assignments()).singleElement().satisfies(a -> assertThat(a.hours()).isEqualTo(3.0));
        assertThat(after.assignments()).isEmpty();
        assertThat(skips.countsByReason()).containsEntry(SkipReason.PROBLEMATIC_NO_FIX, 1);
    }

    @Test
    void generate_restFlaggedDate_isSkippedFromThirdIteration() {
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "1F", 2, "1F"))));
        IterationMemory memory = new IterationMemory();
        memory.merge(List.of(new Violation(ViolationKind.REST_PERIOD, Severity.CRITICAL, "W1", "Worker W1",
                START.plusDays(1), "1F", "short rest", "rest more", new RestPeriodDetail(START, 6.0, 10.0))));

        Schedule before = generate(input, memory, 2, new SkipLog());
        SkipLog skips = new SkipLog();
        Schedule after = generate(input, memory, 3, skips);

        assertThat(before.assignments()).hasSize(2);
        assertThat(after.assignments()).extracting(Assignment::date).containsExactly(START);
        assertThat(skips.byReason(SkipReason.REST_FLAGGED)).hasSize(1);
    }

    @Test
    void resolveCode_preferredCodeFromAvailabilityWarning_isKept() {
        IterationMemory memory = new IterationMemory();
        memory.merge(List.of(new Violation(ViolationKind.AVAILABILITY, Severity.WARNING, "W1", "Worker W1", START, "S",
                "mismatch", "assign M", new AvailabilityDetail("M", "S", false))));
        Worker w = worker("W1", "Kitchen", Map.of(1, "M"));

        assertThat(engine.resolveCode(w, START, "M", memory, 1, new SkipLog())).contains("M");
        assertThat(engine.resolveCode(w, START, "S", memory, 5, new SkipLog())).isEmpty();
    }

    @Test
    void hasStationRoom_closesOnlyAtCeilingWhileSiblingIsShort() {
        StoreProfile store = new StoreProfile("Solo", Map.of("Kitchen", 2, "Counter", 4, "Dessert", 0), 1000, List.of());
        StaffingTally tally = new StaffingTally();
        for (int i = 0; i < 5; i++) {
            tally.increment("Solo", START, "Kitchen");
        }
        tally.increment("Solo", START, "Counter");

        assertThat(engine.hasStationRoom(store, START, "Kitchen", tally)).isTrue();

        tally.increment("Solo", START, "Kitchen");
        assertThat(engine.hasStationRoom(store, START, "Kitchen", tally)).isFalse();

        tally.increment("Solo", START, "Counter");
        assertThat(engine.hasStationRoom(store, START, "Kitchen", tally)).isTrue();
        assertThat(engine.hasStationRoom(store, START, "Dessert", tally)).isTrue();
    }

    @Test
    void seedFor_addsIterationToBaseSeed() {
        assertThat(engine.seedFor(0)).isEqualTo(42L);
        assertThat(engine.seedFor(3)).isEqualTo(45L);
    }

    private static Violation shiftLength(String workerId, LocalDate date, double observed, ShiftLengthDetail.Bound bound) {
        double limit = bound == ShiftLengthDetail.Bound.UNDER ? 3.0 : 12.0;
        return new Violation(ViolationKind.SHIFT_LENGTH, Severity.CRITICAL, workerId, "Worker " + workerId, date, "1F",
                "length", "fix length", new ShiftLengthDetail(observed, limit, bound));
    }
}
