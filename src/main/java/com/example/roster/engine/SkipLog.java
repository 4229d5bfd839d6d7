package com.example.roster.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decisions the generator took not to assign, in the order they were taken. One log per generated schedule.
 */
public class SkipLog {

    private static final Logger logger = LoggerFactory.getLogger(SkipLog.class);

    private final List<AssignmentSkip> skips = new ArrayList<>();

    public void record(String workerId, LocalDate date, String shiftCode, SkipReason reason, String detail) {
        AssignmentSkip skip = new AssignmentSkip(workerId, date, shiftCode, reason, detail);
        skips.add(skip);
        logger.debug("Skipped {} on {} ({}): {} {}", workerId, date, shiftCode, reason, detail);
    }

    public List<AssignmentSkip> skips() {
        return Collections.unmodifiableList(skips);
    }

    public int size() {
        return skips.size();
    }

    public Map<SkipReason, Integer> countsByReason() {
        Map<SkipReason, Integer> counts = new EnumMap<>(SkipReason.class);
        for (AssignmentSkip s : skips) {
            counts.merge(s.reason(), 1, Integer::sum);
        }
        return counts;
    }

    public List<AssignmentSkip> byReason(SkipReason reason) {
        return skips.stream().filter(s -> s.reason() == reason).toList();
    }
}
