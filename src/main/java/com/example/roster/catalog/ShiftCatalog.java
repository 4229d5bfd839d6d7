package com.example.roster.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shift codes known to the store, looked up case-insensitively.
 */
public class ShiftCatalog {

    private static final Logger logger = LoggerFactory.getLogger(ShiftCatalog.class);

    static final double FULL_DAY_HOURS = 12.0;
    static final double HALF_DAY_HOURS = 9.0;
    static final double SHIFT_CHANGE_HOURS = 9.0;
    static final double DAY_SHIFT_HOURS = 8.5;
    static final double MEETING_HOURS = 8.0;

    private final Map<String, ShiftDefinition> byCode;

    public ShiftCatalog(Collection<ShiftDefinition> definitions) {
        Map<String, ShiftDefinition> map = new LinkedHashMap<>();
        for (ShiftDefinition def : definitions) {
            map.put(normalize(def.code()), def);
        }
        this.byCode = Collections.unmodifiableMap(map);
    }

    public Optional<ShiftDefinition> find(String code) {
        return Optional.ofNullable(byCode.get(normalize(code)));
    }

    /**
     * Never null: unknown codes come back as a placeholder with a "TBD" window and 0 hours.
     */
    public ShiftDefinition resolve(String code) {
        return find(code).orElseGet(() -> ShiftDefinition.unknown(code));
    }

    public Collection<ShiftDefinition> definitions() {
        return byCode.values();
    }

    /**
     * Paid hours for a code. When the catalog has no positive value the name and code are matched
     * against the usual patterns, and the minimum shift length is the last resort.
     */
    public double resolveDurationHours(String code, double minShiftHours) {
        ShiftDefinition def = resolve(code);
        if (def.durationHours() > 0) {
            return def.durationHours();
        }
        String name = def.name() == null ? "" : def.name().toLowerCase(Locale.ROOT);
        String c = normalize(code);
        if (name.contains("full") || c.contains("3F")) {
            return FULL_DAY_HOURS;
        }
        if (name.contains("half") || c.contains("1F") || c.contains("2F")) {
            return HALF_DAY_HOURS;
        }
        if (name.contains("shift change") || c.contains("SC")) {
            return SHIFT_CHANGE_HOURS;
        }
        if (name.contains("day") || c.equals("S")) {
            return DAY_SHIFT_HOURS;
        }
        if (name.contains("meeting") || c.equals("M")) {
            return MEETING_HOURS;
        }
        logger.debug("No duration known for shift code {}, using minimum {}h", code, minShiftHours);
        return minShiftHours;
    }

    public static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }
}
