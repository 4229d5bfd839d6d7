package com.example.roster.report;

import java.time.LocalDate;

/**
 * Outcome of one offered availability slot.
 *
 * @param assignedCode null when the slot was not used
 */
public record AvailabilityCheck(String workerId,
                                String workerName,
                                LocalDate date,
                                String requestedCode,
                                String assignedCode,
                                Status status) {

    public enum Status {
        FILLED,
        MISMATCH,
        UNFILLED
    }
}
