package com.example.roster.engine;

/**
 * Why the generator left a requested slot empty.
 */
public enum SkipReason {
    /** The worker already has a shift on that date. */
    ALREADY_ASSIGNED,
    BLACKLISTED,
    PROBLEMATIC_NO_FIX,
    REST_FLAGGED,
    DAILY_CAP,
    WEEKLY_CAP,
    REST_PERIOD,
    STATION_CAPACITY
}
