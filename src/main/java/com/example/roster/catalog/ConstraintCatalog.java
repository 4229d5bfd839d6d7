package com.example.roster.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything the generator needs besides the workers: shift codes, stores, legal limits.
 *
 * @param flexibleCodes codes that count as a match for any requested code (and vice versa)
 */
public record ConstraintCatalog(ShiftCatalog shifts,
                                List<StoreProfile> stores,
                                ConstraintParameters constraints,
                                RestThresholdSchedule restThresholds,
                                Set<String> flexibleCodes) {

    public static final Set<String> DEFAULT_FLEXIBLE_CODES = Set.of("1F", "2F", "3F");

    public ConstraintCatalog {
        stores = stores == null ? List.of() : List.copyOf(stores);
        flexibleCodes = (flexibleCodes == null ? DEFAULT_FLEXIBLE_CODES : flexibleCodes).stream()
                .map(ShiftCatalog::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isFlexible(String code) {
        return flexibleCodes.contains(ShiftCatalog.normalize(code));
    }

    public Optional<StoreProfile> store(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        return stores.stream().filter(s -> s.name().toLowerCase(Locale.ROOT).equals(wanted)).findFirst();
    }
}
