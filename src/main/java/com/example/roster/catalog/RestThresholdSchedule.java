package com.example.roster.catalog;

import java.util.List;

/**
 * Rest gap the generator insists on, by repair iteration. Early iterations accept shorter gaps so that
 * coverage is built up first; from the end of the table on the full statutory minimum applies.
 */
public class RestThresholdSchedule {

    public static final List<Double> DEFAULT_STEPS = List.of(7.0, 8.0, 8.5, 9.0, 9.5);

    private final List<Double> steps;
    private final double fullMinimum;

    public RestThresholdSchedule(List<Double> steps, double fullMinimum) {
        List<Double> copy = steps == null ? List.of() : List.copyOf(steps);
        double previous = 0;
        for (Double step : copy) {
            if (step == null || step < previous) {
                throw new IllegalArgumentException("Rest thresholds must not decrease: " + copy);
            }
            if (step > fullMinimum) {
                throw new IllegalArgumentException("Rest threshold " + step + "h exceeds the minimum rest of " + fullMinimum + "h");
            }
            previous = step;
        }
        this.steps = copy;
        this.fullMinimum = fullMinimum;
    }

    public static RestThresholdSchedule defaults(double fullMinimum) {
        return new RestThresholdSchedule(DEFAULT_STEPS.stream().map(s -> Math.min(s, fullMinimum)).toList(), fullMinimum);
    }

    public double threshold(int iteration) {
        if (iteration < 0) {
            iteration = 0;
        }
        return iteration < steps.size() ? steps.get(iteration) : fullMinimum;
    }

    public double fullMinimum() {
        return fullMinimum;
    }

    public List<Double> steps() {
        return steps;
    }
}
