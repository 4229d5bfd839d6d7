package com.example.roster.iteration;

public enum TerminationReason {
    NO_VIOLATIONS,
    MAX_ITERATIONS,
    EARLY_STOP
}
