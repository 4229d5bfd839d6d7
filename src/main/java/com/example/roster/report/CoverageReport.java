package com.example.roster.report;

import java.util.List;

/**
 * Final audit of a roster against every offered availability slot and every store's station minimums.
 */
public record CoverageReport(RosterStatus status,
                             int totalSlots,
                             int filledSlots,
                             int unfilledSlots,
                             int mismatchedSlots,
                             double coveragePercent,
                             int understaffedCount,
                             List<AvailabilityCheck> availabilityChecks,
                             List<StaffingCheck> staffingChecks,
                             String summary,
                             List<String> recommendations) {

    public CoverageReport {
        availabilityChecks = List.copyOf(availabilityChecks);
        staffingChecks = List.copyOf(staffingChecks);
        recommendations = List.copyOf(recommendations);
    }

    public boolean isApproved() {
        return status == RosterStatus.APPROVED;
    }

    public int staffingMetCount() {
        return staffingChecks.size() - understaffedCount;
    }
}
