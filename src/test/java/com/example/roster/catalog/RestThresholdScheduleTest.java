package com.example.roster.catalog;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestThresholdScheduleTest {

    private final RestThresholdSchedule schedule = RestThresholdSchedule.defaults(10.0);

    @Test
    void threshold_escalatesToFullMinimum() {
        assertThat(schedule.threshold(0)).isEqualTo(7.0);
        assertThat(schedule.threshold(1)).isEqualTo(8.0);
        assertThat(schedule.threshold(2)).isEqualTo(8.5);
        assertThat(schedule.threshold(3)).isEqualTo(9.0);
        assertThat(schedule.threshold(4)).isEqualTo(9.5);
        assertThat(schedule.threshold(5)).isEqualTo(10.0);
        assertThat(schedule.threshold(9)).isEqualTo(10.0);
    }

    @Test
    void threshold_neverDecreases() {
        for (int i = 0; i < 20; i++) {
            assertThat(schedule.threshold(i + 1)).isGreaterThanOrEqualTo(schedule.threshold(i));
            assertThat(schedule.threshold(i)).isLessThanOrEqualTo(schedule.fullMinimum());
        }
    }

    @Test
    void gapOfEightPointTwoHours_passesFirstIterationButNotLater() {
        double gap = 8.2;

        assertThat(gap).isGreaterThanOrEqualTo(schedule.threshold(0));
        assertThat(gap).isLessThan(schedule.threshold(5));
    }

    @Test
    void constructor_rejectsDecreasingOrExcessiveSteps() {
        assertThatThrownBy(() -> new RestThresholdSchedule(List.of(8.0, 7.0), 10.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RestThresholdSchedule(List.of(7.0, 11.0), 10.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void defaults_capStepsAtLowerMinimum() {
        RestThresholdSchedule shortRest = RestThresholdSchedule.defaults(8.0);

        assertThat(shortRest.steps()).containsExactly(7.0, 8.0, 8.0, 8.0, 8.0);
        assertThat(shortRest.threshold(7)).isEqualTo(8.0);
    }
}
