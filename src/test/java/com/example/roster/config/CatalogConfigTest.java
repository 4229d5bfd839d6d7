package com.example.roster.config;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.EmploymentClass;
import com.example.roster.catalog.StoreProfile;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogConfigTest {

    @Test
    void toCatalog_mapsShiftsStoresAndCaps() {
        RosterProperties properties = new RosterProperties();
        RosterProperties.Shift shift = new RosterProperties.Shift();
        shift.setCode(" sc ");
        shift.setTime("11:00 - 20:00");
        shift.setHours(9.0);
        properties.setShifts(List.of(shift));

        RosterProperties.Station kitchen = new RosterProperties.Station();
        kitchen.setName("Kitchen");
        kitchen.setMinimum(3);
        RosterProperties.Peak lunch = new RosterProperties.Peak();
        lunch.setDays(List.of("monday", "FRIDAY"));
        lunch.setStart("11:00");
        lunch.setEnd("14:00");
        RosterProperties.Store store = new RosterProperties.Store();
        store.setName("Harbour");
        store.setTrafficWeight(1200);
        store.setStations(List.of(kitchen));
        store.setPeakWindows(List.of(lunch));
        properties.setStores(List.of(store));
        properties.getConstraints().setWeeklyHourCaps(Map.of("part-time", 25.0));

        ConstraintCatalog catalog = CatalogConfig.toCatalog(properties);

        assertThat(catalog.shifts().find("SC")).hasValueSatisfying(s -> {
            assertThat(s.name()).isEqualTo(" sc ");
            assertThat(s.durationHours()).isEqualTo(9.0);
        });
        StoreProfile harbour = catalog.store("harbour").orElseThrow();
        assertThat(harbour.requiredFor("kitchen")).isEqualTo(3);
        assertThat(harbour.peakWindows()).singleElement().satisfies(p -> {
            assertThat(p.days()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
            assertThat(p.start()).isEqualTo(LocalTime.of(11, 0));
        });
        assertThat(catalog.constraints().weeklyCapFor(EmploymentClass.PART_TIME)).isEqualTo(25.0);
        assertThat(catalog.constraints().weeklyCapFor(EmploymentClass.CASUAL)).isEqualTo(38.0);
        assertThat(catalog.restThresholds().threshold(0)).isEqualTo(7.0);
        assertThat(catalog.isFlexible("2f")).isTrue();
    }
}
