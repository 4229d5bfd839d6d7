package com.example.roster.roster;

import com.example.roster.iteration.IterationOutcome;
import com.example.roster.report.CoverageReport;
import com.example.roster.schedule.Assignment;
import com.example.roster.validation.Violation;

import java.util.List;

public record RosterResponse(RosterRunSummary run,
                             List<Assignment> assignments,
                             List<Violation> violations,
                             CoverageReport report,
                             String reportText,
                             List<IterationOutcome> history) {

    public static RosterResponse from(RosterService.RosterResult result) {
        return new RosterResponse(
                RosterRunSummary.from(result.run()),
                result.outcome().schedule().assignments(),
                result.outcome().violations(),
                result.outcome().report(),
                result.reportText(),
                result.outcome().history());
    }
}
