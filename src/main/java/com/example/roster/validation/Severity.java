package com.example.roster.validation;

public enum Severity {
    CRITICAL,
    WARNING
}
