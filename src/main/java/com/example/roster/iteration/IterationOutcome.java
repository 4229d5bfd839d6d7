package com.example.roster.iteration;

import com.example.roster.engine.SkipReason;
import com.example.roster.validation.ViolationKind;

import java.util.Map;

/**
 * Totals of one generate/validate pass.
 */
public record IterationOutcome(int iteration,
                               int assignmentCount,
                               double totalHours,
                               int violationCount,
                               int criticalCount,
                               int warningCount,
                               Map<ViolationKind, Integer> violationsByKind,
                               Map<SkipReason, Integer> skipsByReason,
                               double coveragePercent) {

    public IterationOutcome {
        violationsByKind = Map.copyOf(violationsByKind);
        skipsByReason = Map.copyOf(skipsByReason);
    }
}
