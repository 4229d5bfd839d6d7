package com.example.roster.engine;

import com.example.roster.validation.AvailabilityDetail;
import com.example.roster.validation.ManagerCoverageDetail;
import com.example.roster.validation.RestPeriodDetail;
import com.example.roster.validation.Severity;
import com.example.roster.validation.ShiftLengthDetail;
import com.example.roster.validation.Violation;
import com.example.roster.validation.ViolationKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.roster.RosterFixtures.START;
import static org.assertj.core.api.Assertions.assertThat;

class IterationMemoryTest {

    private final IterationMemory memory = new IterationMemory();

    @Test
    void merge_sameKeyTwice_countsOnce() {
        Violation v = restViolation("W1");

        assertThat(memory.merge(List.of(v, v))).isEqualTo(1);
        assertThat(memory.merge(List.of(v))).isZero();
        assertThat(memory.size()).isEqualTo(1);
        assertThat(memory.contains(v.key())).isTrue();
    }

    @Test
    void merge_criticalAvailability_blacklistsWorkerDate() {
        memory.merge(List.of(new Violation(ViolationKind.AVAILABILITY, Severity.CRITICAL, "W1", "Worker W1", START, "1F",
                "not available", "remove", new AvailabilityDetail(null, "1F", true))));

        assertThat(memory.isBlacklisted("W1", START)).isTrue();
        assertThat(memory.isBlacklisted("W1", START.plusDays(1))).isFalse();
        assertThat(memory.isProblematic("W1", START, "1f")).isTrue();
        assertThat(memory.blacklistSize()).isEqualTo(1);
    }

    @Test
    void merge_availabilityWarning_remembersRequestedCode() {
        memory.merge(List.of(new Violation(ViolationKind.AVAILABILITY, Severity.WARNING, "W1", "Worker W1", START, "S",
                "mismatch", "assign M", new AvailabilityDetail("m", "S", false))));

        assertThat(memory.preferredCode("W1", START)).contains("M");
        assertThat(memory.isBlacklisted("W1", START)).isFalse();
    }

    @Test
    void merge_restAndShiftLength_areTrackedPerWorker() {
        memory.merge(List.of(
                restViolation("W1"),
                new Violation(ViolationKind.SHIFT_LENGTH, Severity.CRITICAL, "W2", "Worker W2", START, "3F",
                        "too long", "shorten", new ShiftLengthDetail(13.0, 12.0, ShiftLengthDetail.Bound.OVER))));

        assertThat(memory.isRestFlagged("W1", START.plusDays(1))).isTrue();
        assertThat(memory.restFlaggedDates("W1")).containsExactly(START.plusDays(1));
        assertThat(memory.shiftLengthIssue("W2", START))
                .hasValueSatisfying(issue -> assertThat(issue.bound()).isEqualTo(ShiftLengthDetail.Bound.OVER));
        assertThat(memory.shiftLengthIssue("W1", START)).isEmpty();
    }

    @Test
    void merge_groupLevelViolation_isRememberedButChangesNothingPerWorker() {
        memory.merge(List.of(new Violation(ViolationKind.MANAGER_COVERAGE, Severity.CRITICAL, null, null, START, "1F",
                "no manager", "assign one", new ManagerCoverageDetail("06:00 - 15:00", 3))));

        assertThat(memory.size()).isEqualTo(1);
        assertThat(memory.blacklistSize()).isZero();
        assertThat(memory.isProblematic(null, START, "1F")).isFalse();
    }

    private static Violation restViolation(String workerId) {
        return new Violation(ViolationKind.REST_PERIOD, Severity.CRITICAL, workerId, "Worker " + workerId,
                START.plusDays(1), "1F", "short rest", "rest more", new RestPeriodDetail(START, 7.0, 10.0));
    }
}
