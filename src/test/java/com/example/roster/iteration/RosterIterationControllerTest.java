package com.example.roster.iteration;

import com.example.roster.RosterFixtures;
import com.example.roster.catalog.ConstraintCatalog;
import com.example.roster.engine.AssignmentEngine;
import com.example.roster.exception.DataUnavailableException;
import com.example.roster.report.FinalCoverageReporter;
import com.example.roster.report.RosterStatus;
import com.example.roster.schedule.RosterInput;
import com.example.roster.validation.RosterValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static com.example.roster.RosterFixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterIterationControllerTest {

    private final RosterIterationController controller = new RosterIterationController(
            new AssignmentEngine(42), new RosterValidator(), new FinalCoverageReporter());

    @Test
    void run_cleanFirstPass_stopsWithoutViolations() {
        ConstraintCatalog solo = RosterFixtures.catalog(RosterFixtures.shiftDefinitions(), List.of(RosterFixtures.soloStore(1)));
        RosterInput input = RosterFixtures.input(List.of(worker("W1", "Kitchen", Map.of(1, "1F"))), solo);

        RosterRunResult result = controller.run(input, RunOptions.pipeline());

        assertThat(result.terminationReason()).isEqualTo(TerminationReason.NO_VIOLATIONS);
        assertThat(result.iterations()).isEqualTo(1);
        assertThat(result.violations()).isEmpty();
        assertThat(result.schedule().assignments()).hasSize(1);
        assertThat(result.report().status()).isEqualTo(RosterStatus.APPROVED);
        assertThat(result.history()).singleElement()
                .satisfies(h -> assertThat(h.coveragePercent()).isEqualTo(100.0));
        assertThat(result.managers().size()).isEqualTo(20);
    }

    @Test
    void run_crew_endsWithinMaxIterationsAndKeepsHistory() {
        RosterInput input = RosterFixtures.input(RosterFixtures.crew(3));

        RosterRunResult result = controller.run(input, new RunOptions(3, false));

        assertThat(result.iterations()).isBetween(1, 3);
        assertThat(result.history()).hasSize(result.iterations());
        assertThat(result.history()).extracting(IterationOutcome::iteration)
                .containsExactlyElementsOf(IntStream.range(0, result.iterations()).boxed().toList());
        if (result.iterations() < 3) {
            assertThat(result.terminationReason()).isEqualTo(TerminationReason.NO_VIOLATIONS);
        } else {
            assertThat(result.terminationReason()).isIn(TerminationReason.NO_VIOLATIONS, TerminationReason.MAX_ITERATIONS);
        }
        assertThat(result.criticalCount()).isLessThanOrEqualTo(result.violations().size());
    }

    @Test
    void run_sameInput_isReproducible() {
        RosterInput input = RosterFixtures.input(RosterFixtures.crew(2));

        RosterRunResult first = controller.run(input, RunOptions.pipeline());
        RosterRunResult second = controller.run(input, RunOptions.pipeline());

        assertThat(second.schedule()).isEqualTo(first.schedule());
        assertThat(second.violations()).isEqualTo(first.violations());
        assertThat(second.runId()).isNotEqualTo(first.runId());
    }

    @Test
    void run_noWorkers_throws() {
        RosterInput input = RosterFixtures.input(List.of());

        assertThatThrownBy(() -> controller.run(input, RunOptions.interactive()))
                .isInstanceOf(DataUnavailableException.class)
                .satisfies(e -> assertThat(((DataUnavailableException) e).getErrorCode()).isEqualTo("NO_WORKERS"));
    }

    @Test
    void decide_appliesRulesInOrder() {
        RunOptions interactive = RunOptions.interactive();

        assertThat(RosterIterationController.decide(0, 0, 10.0, interactive)).contains(TerminationReason.NO_VIOLATIONS);
        assertThat(RosterIterationController.decide(6, 50, 10.0, interactive)).contains(TerminationReason.MAX_ITERATIONS);
        assertThat(RosterIterationController.decide(2, 10, 90.0, interactive)).contains(TerminationReason.EARLY_STOP);
        assertThat(RosterIterationController.decide(1, 10, 95.0, interactive)).isEmpty();
        assertThat(RosterIterationController.decide(2, 11, 95.0, interactive)).isEmpty();
        assertThat(RosterIterationController.decide(2, 5, 89.99, interactive)).isEmpty();
        assertThat(RosterIterationController.decide(2, 5, 99.0, RunOptions.pipeline())).isEmpty();
        assertThat(RosterIterationController.decide(4, 5, 99.0, RunOptions.pipeline())).contains(TerminationReason.MAX_ITERATIONS);
    }

    @Test
    void runOptions_clampsIterationCount() {
        assertThat(new RunOptions(0, true).maxIterations()).isEqualTo(1);
        assertThat(new RunOptions(25, false).maxIterations()).isEqualTo(10);
        assertThat(RunOptions.pipeline()).isEqualTo(new RunOptions(5, false));
        assertThat(RunOptions.interactive()).isEqualTo(new RunOptions(7, true));
    }
}
