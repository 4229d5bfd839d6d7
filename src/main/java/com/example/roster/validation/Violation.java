package com.example.roster.validation;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A rule breach found in a finished schedule. Never mutated after the validator creates it.
 * {@code workerId} and {@code shiftCode} are null for group-level findings (manager and store coverage).
 */
public record Violation(ViolationKind kind,
                        Severity severity,
                        String workerId,
                        String workerName,
                        LocalDate date,
                        String shiftCode,
                        String message,
                        String recommendation,
                        ViolationDetail detail) {

    public Violation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    public ViolationKey key() {
        return ViolationKey.of(this);
    }
}
