package com.example.roster.report;

public enum RosterStatus {
    APPROVED("approved"),
    NEEDS_REVIEW("needs_review");

    private final String code;

    RosterStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
