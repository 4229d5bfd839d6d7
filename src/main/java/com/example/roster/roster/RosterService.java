package com.example.roster.roster;

import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.catalog.EmploymentClass;
import com.example.roster.config.RosterProperties;
import com.example.roster.exception.RosterNotFoundException;
import com.example.roster.iteration.RosterIterationController;
import com.example.roster.iteration.RosterRunResult;
import com.example.roster.iteration.RunOptions;
import com.example.roster.report.CoverageReport;
import com.example.roster.report.CoverageReportRenderer;
import com.example.roster.schedule.Assignment;
import com.example.roster.schedule.RosterInput;
import com.example.roster.schedule.Schedule;
import com.example.roster.worker.Availability;
import com.example.roster.worker.Horizon;
import com.example.roster.worker.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class RosterService {

    private static final Logger logger = LoggerFactory.getLogger(RosterService.class);

    private final RosterIterationController iterationController;
    private final CoverageReportRenderer reportRenderer;
    private final RosterCsvExporter csvExporter;
    private final RosterRunRepository runRepository;
    private final RosterAssignmentRecordRepository assignmentRepository;
    private final ConstraintCatalog catalog;
    private final RosterProperties properties;

    public RosterService(RosterIterationController iterationController,
                         CoverageReportRenderer reportRenderer,
                         RosterCsvExporter csvExporter,
                         RosterRunRepository runRepository,
                         RosterAssignmentRecordRepository assignmentRepository,
                         ConstraintCatalog catalog,
                         RosterProperties properties) {
        this.iterationController = iterationController;
        this.reportRenderer = reportRenderer;
        this.csvExporter = csvExporter;
        this.runRepository = runRepository;
        this.assignmentRepository = assignmentRepository;
        this.catalog = catalog;
        this.properties = properties;
    }

    /**
     * 画面からの作成。早期終了あり。
     */
    public RunOptions interactiveOptions(Integer maxIterations) {
        int max = maxIterations != null ? maxIterations : properties.getIteration().getInteractiveMaxIterations();
        return new RunOptions(max, true);
    }

    /**
     * 一括作成。早期終了なしで上限まで回す。
     */
    public RunOptions pipelineOptions(Integer maxIterations) {
        int max = maxIterations != null ? maxIterations : properties.getIteration().getMaxIterations();
        return new RunOptions(max, false);
    }

    @Transactional
    public RosterResult generate(RosterRequest request, RunOptions options) {
        RosterInput input = toInput(request, catalog);
        RosterRunResult outcome = iterationController.run(input, options);
        String reportText = reportRenderer.render(outcome.report());

        RosterRun run = runRepository.save(toEntity(outcome, reportText));
        logger.info("Roster run {} saved as #{}: {} assignments, status {}",
                outcome.runId(), run.getId(), run.getAssignmentCount(), run.getStatus());
        return new RosterResult(run, outcome, reportText);
    }

    @Transactional(readOnly = true)
    public RosterRunSummary latest() {
        return runRepository.findTopByOrderByCreatedAtDescIdDesc()
                .map(RosterRunSummary::from)
                .orElseThrow(() -> new RosterNotFoundException(null));
    }

    /**
     * 作成時に出力した最終チェックレポート。
     */
    @Transactional(readOnly = true)
    public String report(Long runId) {
        return runRepository.findById(runId)
                .map(RosterRun::getReportText)
                .orElseThrow(() -> new RosterNotFoundException(runId));
    }

    @Transactional(readOnly = true)
    public RosterCsvExporter.CsvFile export(Long runId) {
        RosterRun run = runRepository.findById(runId).orElseThrow(() -> new RosterNotFoundException(runId));
        List<Assignment> assignments = assignmentRepository.findByRun_IdOrderByWorkDateAscIdAsc(runId).stream()
                .map(RosterAssignmentRecord::toAssignment)
                .toList();
        return csvExporter.export(assignments, run.getStartDate());
    }

    static RosterInput toInput(RosterRequest request, ConstraintCatalog catalog) {
        List<Worker> workers = request.workers() == null ? List.of() : request.workers().stream()
                .map(w -> new Worker(w.id().trim(), w.name(), EmploymentClass.fromText(w.employmentType()),
                        w.station(), new Availability(w.availability())))
                .toList();
        Set<String> ids = new HashSet<>();
        for (Worker worker : workers) {
            if (!ids.add(worker.id())) {
                throw new IllegalArgumentException("従業員IDが重複しています: " + worker.id());
            }
        }
        return new RosterInput(workers, catalog, Horizon.fourteenDaysFrom(request.startDate()));
    }

    private RosterRun toEntity(RosterRunResult outcome, String reportText) {
        Schedule schedule = outcome.schedule();
        CoverageReport report = outcome.report();
        RosterRun run = new RosterRun(outcome.runId(), schedule.startDate(), schedule.endDate());
        run.setIterations(outcome.iterations());
        run.setTerminationReason(outcome.terminationReason());
        run.setAssignmentCount(schedule.shiftCount());
        run.setTotalHours(schedule.totalHours());
        run.setWorkersScheduled(schedule.distinctWorkers().size());
        run.setViolationCount(outcome.violations().size());
        run.setCriticalCount((int) outcome.criticalCount());
        run.setCoveragePercent(report.coveragePercent());
        run.setStatus(report.status());
        run.setSummary(report.summary());
        run.setTotalSlots(report.totalSlots());
        run.setFilledSlots(report.filledSlots());
        run.setUnfilledSlots(report.unfilledSlots());
        run.setMismatchedSlots(report.mismatchedSlots());
        run.setRecommendations(report.recommendations());
        run.setReportText(reportText);
        schedule.assignments().forEach(a -> run.addAssignment(RosterAssignmentRecord.from(a)));
        return run;
    }

    public record RosterResult(RosterRun run, RosterRunResult outcome, String reportText) {
    }
}
