package com.example.roster.validation;

/**
 * Structured payload of a {@link Violation}. Each kind has its own record type.
 */
public interface ViolationDetail {
}
