package com.example.roster.roster;

import com.example.roster.iteration.TerminationReason;
import com.example.roster.report.RosterStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record RosterRunSummary(Long id,
                               LocalDate startDate,
                               LocalDate endDate,
                               int iterations,
                               TerminationReason terminationReason,
                               int assignmentCount,
                               double totalHours,
                               int workersScheduled,
                               int violationCount,
                               int criticalCount,
                               double coveragePercent,
                               int totalSlots,
                               int filledSlots,
                               int unfilledSlots,
                               int mismatchedSlots,
                               List<String> recommendations,
                               RosterStatus status,
                               String summary,
                               LocalDateTime createdAt) {

    public static RosterRunSummary from(RosterRun run) {
        return new RosterRunSummary(run.getId(), run.getStartDate(), run.getEndDate(), run.getIterations(),
                run.getTerminationReason(), run.getAssignmentCount(), run.getTotalHours(), run.getWorkersScheduled(),
                run.getViolationCount(), run.getCriticalCount(), run.getCoveragePercent(),
                run.getTotalSlots(), run.getFilledSlots(), run.getUnfilledSlots(), run.getMismatchedSlots(),
                run.getRecommendations(), run.getStatus(),
                run.getSummary(), run.getCreatedAt());
    }
}
