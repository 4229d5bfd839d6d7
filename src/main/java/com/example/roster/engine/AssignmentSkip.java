package com.example.roster.engine;

import java.time.LocalDate;

public record AssignmentSkip(String workerId, LocalDate date, String shiftCode, SkipReason reason, String detail) {
}
