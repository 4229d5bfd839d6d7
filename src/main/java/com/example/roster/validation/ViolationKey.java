package com.example.roster.validation;

import java.time.LocalDate;

/**
 * Identity used to deduplicate violations across the iterations of one run.
 */
public record ViolationKey(String workerId, LocalDate date, ViolationKind kind, String shiftCode) {

    public static ViolationKey of(Violation v) {
        return new ViolationKey(v.workerId(), v.date(), v.kind(), v.shiftCode());
    }
}
