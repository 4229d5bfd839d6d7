package com.example.roster.engine;

import com.example.roster.catalog.ShiftCatalog;
import com.example.roster.validation.AvailabilityDetail;
import com.example.roster.validation.RestPeriodDetail;
import com.example.roster.validation.ShiftLengthDetail;
import com.example.roster.validation.Violation;
import com.example.roster.validation.ViolationKey;
import com.example.roster.validation.ViolationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.*;

/**
 * 反復間で引き継ぐ修正情報。1回の実行の間だけ生き、実行ごとに新しく作る。
 * <p>
 * A violation is merged once per {@link ViolationKey}; a key seen in an earlier iteration is ignored even if
 * a later pass reports it again.
 */
public class IterationMemory {

    private static final Logger logger = LoggerFactory.getLogger(IterationMemory.class);

    private final Set<ViolationKey> seen = new LinkedHashSet<>();
    private final Set<WorkerDate> blacklist = new HashSet<>();
    private final Map<WorkerDate, String> preferredCodes = new HashMap<>();
    private final Set<ProblematicShift> problematic = new HashSet<>();
    private final Map<String, Set<LocalDate>> restFlaggedDates = new HashMap<>();
    private final Map<WorkerDate, ShiftLengthIssue> shiftLengthIssues = new HashMap<>();

    /**
     * @return number of violations that were new to this run
     */
    public int merge(List<Violation> violations) {
        int added = 0;
        for (Violation v : violations) {
            if (!seen.add(v.key())) {
                continue;
            }
            added++;
            absorb(v);
        }
        logger.debug("Merged {} new of {} violations; memory holds {} keys, {} blacklisted",
                added, violations.size(), seen.size(), blacklist.size());
        return added;
    }

    private void absorb(Violation v) {
        boolean hasWorkerDate = v.workerId() != null && v.date() != null;
        if (hasWorkerDate && v.shiftCode() != null) {
            problematic.add(new ProblematicShift(v.workerId(), v.date(), ShiftCatalog.normalize(v.shiftCode())));
        }
        if (!hasWorkerDate) {
            return;
        }
        WorkerDate wd = new WorkerDate(v.workerId(), v.date());
        if (v.kind() == ViolationKind.AVAILABILITY) {
            if (v.isCritical()) {
                blacklist.add(wd);
            } else if (v.detail() instanceof AvailabilityDetail detail && detail.requestedCode() != null) {
                preferredCodes.put(wd, ShiftCatalog.normalize(detail.requestedCode()));
            }
        } else if (v.kind() == ViolationKind.REST_PERIOD && v.detail() instanceof RestPeriodDetail) {
            restFlaggedDates.computeIfAbsent(v.workerId(), k -> new TreeSet<>()).add(v.date());
        } else if (v.kind() == ViolationKind.SHIFT_LENGTH && v.detail() instanceof ShiftLengthDetail detail) {
            shiftLengthIssues.put(wd, new ShiftLengthIssue(detail.observedHours(), detail.bound()));
        }
    }

    public boolean contains(ViolationKey key) {
        return seen.contains(key);
    }

    public boolean isBlacklisted(String workerId, LocalDate date) {
        return blacklist.contains(new WorkerDate(workerId, date));
    }

    public Optional<String> preferredCode(String workerId, LocalDate date) {
        return Optional.ofNullable(preferredCodes.get(new WorkerDate(workerId, date)));
    }

    public boolean isProblematic(String workerId, LocalDate date, String shiftCode) {
        return problematic.contains(new ProblematicShift(workerId, date, ShiftCatalog.normalize(shiftCode)));
    }

    public boolean isRestFlagged(String workerId, LocalDate date) {
        return restFlaggedDates.getOrDefault(workerId, Set.of()).contains(date);
    }

    public List<LocalDate> restFlaggedDates(String workerId) {
        return List.copyOf(restFlaggedDates.getOrDefault(workerId, Set.of()));
    }

    public Optional<ShiftLengthIssue> shiftLengthIssue(String workerId, LocalDate date) {
        return Optional.ofNullable(shiftLengthIssues.get(new WorkerDate(workerId, date)));
    }

    public int size() {
        return seen.size();
    }

    public int blacklistSize() {
        return blacklist.size();
    }

    public record ShiftLengthIssue(double observedHours, ShiftLengthDetail.Bound bound) {
    }

    private record WorkerDate(String workerId, LocalDate date) {
    }

    private record ProblematicShift(String workerId, LocalDate date, String shiftCode) {
    }
}
