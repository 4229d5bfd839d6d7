package com.example.roster.report;

import java.time.LocalDate;

public record StaffingCheck(String store,
                            LocalDate date,
                            String station,
                            int required,
                            int assigned,
                            Status status,
                            String details) {

    public enum Status {
        MET,
        UNDERSTAFFED
    }

    public boolean isUnderstaffed() {
        return status == Status.UNDERSTAFFED;
    }
}
