package com.example.roster.worker;

import com.example.roster.catalog.EmploymentClass;

import java.util.Objects;

/**
 * A member of staff as loaded from the staff list. Immutable.
 *
 * @param station home station, e.g. "Kitchen" or "Dessert Station"
 */
public record Worker(String id,
                     String name,
                     EmploymentClass employmentClass,
                     String station,
                     Availability availability) {

    public Worker {
        Objects.requireNonNull(id, "id");
        name = name == null ? id : name;
        employmentClass = employmentClass == null ? EmploymentClass.FULL_TIME : employmentClass;
        station = station == null ? "" : station.trim();
        availability = availability == null ? Availability.none() : availability;
    }
}
