package com.example.roster.iteration;

import com.example.roster.engine.SkipLog;
import com.example.roster.report.CoverageReport;
import com.example.roster.schedule.ManagerPool;
import com.example.roster.schedule.Schedule;
import com.example.roster.validation.Violation;

import java.util.List;

/**
 * Outcome of a finished run: the last schedule, its violations and the final audit.
 *
 * @param iterations number of passes actually run
 */
public record RosterRunResult(String runId,
                              Schedule schedule,
                              List<Violation> violations,
                              CoverageReport report,
                              int iterations,
                              TerminationReason terminationReason,
                              List<IterationOutcome> history,
                              SkipLog finalSkips,
                              ManagerPool managers) {

    public RosterRunResult {
        violations = List.copyOf(violations);
        history = List.copyOf(history);
    }

    public long criticalCount() {
        return violations.stream().filter(Violation::isCritical).count();
    }
}
