package com.example.roster.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;

public enum AssignmentStatus {
    SCHEDULED("Scheduled"),
    WEEKEND("Weekend");

    private final String label;

    AssignmentStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static AssignmentStatus forDate(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY ? WEEKEND : SCHEDULED;
    }
}
