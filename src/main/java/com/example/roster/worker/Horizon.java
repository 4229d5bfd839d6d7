package com.example.roster.worker;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * The scheduling window. Day 1 is {@code startDate}.
 */
public record Horizon(LocalDate startDate, int days) {

    public static final int DEFAULT_DAYS = 14;

    public Horizon {
        Objects.requireNonNull(startDate, "startDate");
        if (days <= 0) {
            throw new IllegalArgumentException("Horizon must cover at least one day");
        }
    }

    public static Horizon fourteenDaysFrom(LocalDate startDate) {
        return new Horizon(startDate, DEFAULT_DAYS);
    }

    public LocalDate dateOf(int dayIndex) {
        return startDate.plusDays(dayIndex - 1L);
    }

    public OptionalInt dayIndexOf(LocalDate date) {
        if (date == null) {
            return OptionalInt.empty();
        }
        long offset = ChronoUnit.DAYS.between(startDate, date);
        if (offset < 0 || offset >= days) {
            return OptionalInt.empty();
        }
        return OptionalInt.of((int) offset + 1);
    }

    public LocalDate endDate() {
        return dateOf(days);
    }

    public List<LocalDate> dates() {
        List<LocalDate> list = new ArrayList<>(days);
        for (int i = 1; i <= days; i++) {
            list.add(dateOf(i));
        }
        return list;
    }
}
