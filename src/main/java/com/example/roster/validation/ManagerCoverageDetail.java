package com.example.roster.validation;

public record ManagerCoverageDetail(String shiftTime, int assignmentCount) implements ViolationDetail {
}
