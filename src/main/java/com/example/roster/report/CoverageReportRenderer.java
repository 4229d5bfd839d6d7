package com.example.roster.report;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-text rendering of a {@link CoverageReport}.
 */
@Component
public class CoverageReportRenderer {

    private static final String RULE = "=".repeat(80);
    private static final String LINE = "-".repeat(80);

    public String render(CoverageReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("FINAL ROSTER CHECK REPORT\n");
        sb.append(RULE).append("\n\n");
        sb.append("ROSTER STATUS: ").append(report.status().getCode().toUpperCase()).append('\n');
        sb.append(report.summary()).append("\n\n");

        section(sb, "AVAILABILITY COVERAGE");
        sb.append("Total Availability Slots: ").append(report.totalSlots()).append('\n');
        sb.append("Filled Slots: ").append(report.filledSlots()).append('\n');
        sb.append("Unfilled Slots: ").append(report.unfilledSlots()).append('\n');
        sb.append("Mismatched Slots: ").append(report.mismatchedSlots()).append('\n');
        sb.append("Coverage: ").append(report.coveragePercent()).append("%\n\n");
        if (report.unfilledSlots() > 0) {
            sb.append("UNFILLED AVAILABILITY SLOTS:\n");
            for (AvailabilityCheck c : report.availabilityChecks()) {
                if (c.status() == AvailabilityCheck.Status.UNFILLED) {
                    sb.append("  - ").append(c.workerName()).append(" (").append(c.workerId()).append(") on ")
                            .append(c.date()).append(": Available for ").append(c.requestedCode())
                            .append(", but not assigned\n");
                }
            }
            sb.append('\n');
        }

        section(sb, "STAFFING REQUIREMENTS CHECK");
        sb.append("Total Staffing Checks: ").append(report.staffingChecks().size()).append('\n');
        sb.append("Requirements Met: ").append(report.staffingMetCount()).append('\n');
        sb.append("Understaffed: ").append(report.understaffedCount()).append("\n");
        for (Map.Entry<StoreDate, List<StaffingCheck>> e : groupByStoreDate(report.staffingChecks()).entrySet()) {
            sb.append('\n').append(e.getKey().store()).append(" - ").append(e.getKey().date()).append(":\n");
            for (StaffingCheck c : e.getValue()) {
                sb.append("  [").append(c.isUnderstaffed() ? "NG" : "OK").append("] ")
                        .append(c.station()).append(": ").append(c.assigned()).append('/').append(c.required())
                        .append(" (").append(c.status().name().toLowerCase()).append(")\n");
                if (c.isUnderstaffed()) {
                    sb.append("       ").append(c.details()).append('\n');
                }
            }
        }
        sb.append('\n');

        section(sb, "RECOMMENDATIONS");
        int i = 1;
        for (String rec : report.recommendations()) {
            sb.append(i++).append(". ").append(rec).append('\n');
        }
        sb.append('\n').append(RULE).append('\n');
        sb.append("END OF REPORT\n");
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title) {
        sb.append(LINE).append('\n').append(title).append('\n').append(LINE).append('\n');
    }

    private static Map<StoreDate, List<StaffingCheck>> groupByStoreDate(List<StaffingCheck> checks) {
        Map<StoreDate, List<StaffingCheck>> grouped = new LinkedHashMap<>();
        for (StaffingCheck c : checks) {
            grouped.computeIfAbsent(new StoreDate(c.store(), c.date()), k -> new ArrayList<>()).add(c);
        }
        return grouped;
    }

    private record StoreDate(String store, LocalDate date) {
    }
}
