package com.example.roster.validation;

import java.util.List;

public record StoreCoverageDetail(String store, List<String> missingStations) implements ViolationDetail {

    public StoreCoverageDetail {
        missingStations = missingStations == null ? List.of() : List.copyOf(missingStations);
    }
}
