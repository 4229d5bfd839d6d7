package com.example.roster.iteration;

import com.example.roster.engine.SkipLog;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 1回の実行の進行状況。実行ごとに作り、実行間で共有しない。
 */
public class RunContext {

    private final String runId = UUID.randomUUID().toString();
    private final LocalDateTime startedAt = LocalDateTime.now();
    private final List<IterationOutcome> history = new ArrayList<>();
    private final Map<Integer, SkipLog> skipLogs = new LinkedHashMap<>();
    private Phase phase = Phase.GENERATE;
    private TerminationReason terminationReason;

    public String getRunId() {
        return runId;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public Phase getPhase() {
        return phase;
    }

    void enter(Phase next) {
        this.phase = next;
    }

    SkipLog startIteration(int iteration) {
        SkipLog log = new SkipLog();
        skipLogs.put(iteration, log);
        return log;
    }

    void record(IterationOutcome outcome) {
        history.add(outcome);
    }

    void finish(TerminationReason reason) {
        this.terminationReason = reason;
        this.phase = Phase.FINALIZE;
    }

    public List<IterationOutcome> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Optional<SkipLog> skipLog(int iteration) {
        return Optional.ofNullable(skipLogs.get(iteration));
    }

    public Optional<TerminationReason> getTerminationReason() {
        return Optional.ofNullable(terminationReason);
    }
}
