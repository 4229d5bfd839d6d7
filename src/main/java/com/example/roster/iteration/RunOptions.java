package com.example.roster.iteration;

/**
 * How long a run may keep repairing.
 *
 * @param maxIterations hard cap, always within [{@value #MIN_ITERATIONS}, {@value #MAX_ITERATIONS}]
 * @param earlyStop     stop once coverage is high and few violations remain
 */
public record RunOptions(int maxIterations, boolean earlyStop) {

    public static final int MIN_ITERATIONS = 1;
    public static final int MAX_ITERATIONS = 10;
    public static final int PIPELINE_ITERATIONS = 5;
    public static final int INTERACTIVE_ITERATIONS = 7;

    public RunOptions {
        maxIterations = Math.max(MIN_ITERATIONS, Math.min(MAX_ITERATIONS, maxIterations));
    }

    /** Batch generation: fixed number of passes, no early stop. */
    public static RunOptions pipeline() {
        return new RunOptions(PIPELINE_ITERATIONS, false);
    }

    /** Request/response generation. */
    public static RunOptions interactive() {
        return new RunOptions(INTERACTIVE_ITERATIONS, true);
    }
}
