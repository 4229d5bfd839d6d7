package com.example.roster.validation;

public enum ViolationKind {
    AVAILABILITY("availability"),
    MANAGER_COVERAGE("manager_coverage"),
    SHIFT_LENGTH("shift_length"),
    REST_PERIOD("rest_period"),
    STORE_COVERAGE("store_coverage");

    private final String code;

    ViolationKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
