package com.example.roster.validation;

public record ShiftLengthDetail(double observedHours, double boundHours, Bound bound) implements ViolationDetail {

    public enum Bound {
        UNDER,
        OVER
    }
}
