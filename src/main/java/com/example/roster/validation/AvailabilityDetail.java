package com.example.roster.validation;

/**
 * @param requestedCode code the worker asked for on that date, null when the date was not offered
 * @param unavailable   true when the worker is not available on that date at all
 */
public record AvailabilityDetail(String requestedCode, String assignedCode, boolean unavailable)
        implements ViolationDetail {
}
