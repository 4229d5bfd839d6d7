package com.example.roster.iteration;

import com.example.roster.engine.AssignmentEngine;
import com.example.roster.engine.IterationMemory;
import com.example.roster.engine.SkipLog;
import com.example.roster.exception.DataUnavailableException;
import com.example.roster.report.CoverageReport;
import com.example.roster.report.FinalCoverageReporter;
import com.example.roster.schedule.ManagerPool;
import com.example.roster.schedule.RosterInput;
import com.example.roster.schedule.Schedule;
import com.example.roster.validation.RosterValidator;
import com.example.roster.validation.Severity;
import com.example.roster.validation.Violation;
import com.example.roster.validation.ViolationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 生成 → 検証 → 修正 のループを回す。
 * <p>
 * Each pass builds a fresh schedule from the inputs plus everything learned so far, validates it and either
 * stops or merges the new violations into the run's {@link IterationMemory}. The loop always ends within
 * {@link RunOptions#maxIterations()} passes.
 */
@Service
public class RosterIterationController {

    private static final Logger logger = LoggerFactory.getLogger(RosterIterationController.class);

    static final int EARLY_STOP_MIN_ITERATION = 3;
    static final double EARLY_STOP_MIN_COVERAGE = 90.0;
    static final int EARLY_STOP_MAX_VIOLATIONS = 10;

    private final AssignmentEngine engine;
    private final RosterValidator validator;
    private final FinalCoverageReporter reporter;

    public RosterIterationController(AssignmentEngine engine, RosterValidator validator, FinalCoverageReporter reporter) {
        this.engine = engine;
        this.validator = validator;
        this.reporter = reporter;
    }

    public RosterRunResult run(RosterInput input, RunOptions options) {
        if (input.workers().isEmpty()) {
            throw DataUnavailableException.noWorkers();
        }
        if (input.catalog() == null || input.catalog().constraints() == null) {
            throw DataUnavailableException.noConstraints();
        }

        RunContext context = new RunContext();
        ManagerPool managers = ManagerPool.generate(input.workers().size(), engine.seedFor(0));
        IterationMemory memory = new IterationMemory();
        logger.info("Run {} started: {} workers, {} days from {}, max {} iterations{}",
                context.getRunId(), input.workers().size(), input.horizon().days(), input.horizon().startDate(),
                options.maxIterations(), options.earlyStop() ? " (early stop)" : "");

        int iteration = 0;
        Schedule schedule;
        List<Violation> violations;
        SkipLog skips;
        TerminationReason reason;
        while (true) {
            context.enter(Phase.GENERATE);
            skips = context.startIteration(iteration);
            schedule = engine.generate(input, managers, memory, iteration, skips);

            context.enter(Phase.VALIDATE);
            violations = validator.validate(schedule, input, managers);
            double coverage = reporter.coverage(schedule, input);
            context.record(outcome(iteration, schedule, violations, skips, coverage));
            logger.info("Iteration {}: {} violations, coverage {}%", iteration, violations.size(), coverage);

            Optional<TerminationReason> stop = decide(iteration, violations.size(), coverage, options);
            if (stop.isPresent()) {
                reason = stop.get();
                break;
            }
            context.enter(Phase.LOOP);
            memory.merge(violations);
            iteration++;
        }

        context.finish(reason);
        CoverageReport report = reporter.report(schedule, input);
        logger.info("Run {} finished after {} iterations ({}): {} assignments, {} violations, {}",
                context.getRunId(), iteration + 1, reason, schedule.shiftCount(), violations.size(), report.status());
        return new RosterRunResult(context.getRunId(), schedule, violations, report, iteration + 1, reason,
                context.getHistory(), skips, managers);
    }

    /**
     * Termination rule. {@code iteration} is zero-based; the early-stop threshold counts passes from one.
     */
    static Optional<TerminationReason> decide(int iteration, int violationCount, double coverage, RunOptions options) {
        if (violationCount == 0) {
            return Optional.of(TerminationReason.NO_VIOLATIONS);
        }
        if (iteration + 1 >= options.maxIterations()) {
            return Optional.of(TerminationReason.MAX_ITERATIONS);
        }
        if (options.earlyStop()
                && iteration + 1 >= EARLY_STOP_MIN_ITERATION
                && coverage >= EARLY_STOP_MIN_COVERAGE
                && violationCount <= EARLY_STOP_MAX_VIOLATIONS) {
            return Optional.of(TerminationReason.EARLY_STOP);
        }
        return Optional.empty();
    }

    private static IterationOutcome outcome(int iteration, Schedule schedule, List<Violation> violations,
                                            SkipLog skips, double coverage) {
        Map<ViolationKind, Integer> byKind = new EnumMap<>(ViolationKind.class);
        int critical = 0;
        for (Violation v : violations) {
            byKind.merge(v.kind(), 1, Integer::sum);
            if (v.severity() == Severity.CRITICAL) {
                critical++;
            }
        }
        return new IterationOutcome(iteration, schedule.shiftCount(), schedule.totalHours(), violations.size(),
                critical, violations.size() - critical, byKind, skips.countsByReason(), coverage);
    }
}
