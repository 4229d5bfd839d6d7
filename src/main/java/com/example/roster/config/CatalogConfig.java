package com.example.roster.config;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.ConstraintParameters;
import com.example.roster.catalog.EmploymentClass;
import com.example.roster.catalog.PeakWindow;
import com.example.roster.catalog.RestThresholdSchedule;
import com.example.roster.catalog.ShiftCatalog;
import com.example.roster.catalog.ShiftDefinition;
import com.example.roster.catalog.StoreProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Configuration
@EnableConfigurationProperties(RosterProperties.class)
public class CatalogConfig {

    private static final Logger logger = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public ConstraintCatalog constraintCatalog(RosterProperties properties) {
        ConstraintCatalog catalog = toCatalog(properties);
        logger.info("Roster catalog loaded: {} shift codes, {} stores, rest thresholds {} -> {}h",
                catalog.shifts().definitions().size(), catalog.stores().size(),
                catalog.restThresholds().steps(), catalog.restThresholds().fullMinimum());
        return catalog;
    }

    public static ConstraintCatalog toCatalog(RosterProperties properties) {
        RosterProperties.Constraints c = properties.getConstraints();
        Map<EmploymentClass, Double> caps = new EnumMap<>(EmploymentClass.class);
        c.getWeeklyHourCaps().forEach((key, value) -> caps.put(EmploymentClass.fromText(key), value));
        ConstraintParameters parameters = new ConstraintParameters(c.getMinShiftHours(), c.getMaxShiftHours(),
                c.getMinRestHours(), c.getDailyHourCap(), caps, c.getMaxManagersPerStorePerDay());

        List<ShiftDefinition> shifts = properties.getShifts().stream()
                .map(s -> new ShiftDefinition(ShiftCatalog.normalize(s.getCode()), s.getTime(), s.getHours(),
                        s.getName() == null ? s.getCode() : s.getName()))
                .toList();
        List<StoreProfile> stores = properties.getStores().stream().map(CatalogConfig::toStore).toList();

        RestThresholdSchedule rest = properties.getRestThresholds().isEmpty()
                ? RestThresholdSchedule.defaults(c.getMinRestHours())
                : new RestThresholdSchedule(properties.getRestThresholds(), c.getMinRestHours());

        return new ConstraintCatalog(new ShiftCatalog(shifts), stores, parameters, rest,
                new LinkedHashSet<>(properties.getFlexibleCodes()));
    }

    private static StoreProfile toStore(RosterProperties.Store store) {
        Map<String, Integer> minimums = new LinkedHashMap<>();
        for (RosterProperties.Station station : store.getStations()) {
            minimums.put(station.getName(), station.getMinimum());
        }
        List<PeakWindow> peaks = store.getPeakWindows().stream()
                .map(p -> new PeakWindow(toDays(p.getDays()), LocalTime.parse(p.getStart()), LocalTime.parse(p.getEnd())))
                .toList();
        return new StoreProfile(store.getName(), minimums, store.getTrafficWeight(), peaks);
    }

    private static Set<DayOfWeek> toDays(List<String> days) {
        Set<DayOfWeek> set = new LinkedHashSet<>();
        for (String day : days) {
            set.add(DayOfWeek.valueOf(day.trim().toUpperCase(Locale.ROOT)));
        }
        return set;
    }
}
