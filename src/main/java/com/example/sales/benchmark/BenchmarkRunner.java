package com.example.sales.benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Times repeated runs of an aggregation task.
 *
 * <p>Warm-up iterations run first and are not recorded. Every result, warm-up
 * included, is passed to the validator outside the timed region, so a wrong
 * answer aborts the benchmark instead of producing a fast but meaningless number.
 */
public class BenchmarkRunner {

    private final int warmupIterations;
    private final int measuredIterations;

    /**
     * @param warmupIterations   unrecorded iterations, not negative
     * @param measuredIterations recorded iterations, at least 1
     */
    public BenchmarkRunner(int warmupIterations, int measuredIterations) {
        if (warmupIterations < 0) {
            throw new IllegalArgumentException("warmupIterations must not be negative");
        }
        if (measuredIterations < 1) {
            throw new IllegalArgumentException("measuredIterations must be at least 1");
        }
        this.warmupIterations = warmupIterations;
        this.measuredIterations = measuredIterations;
    }

    /**
     * Runs {@code task} and times each measured iteration.
     *
     * @param variant     name reported in the result
     * @param recordCount records processed per iteration
     * @param task        the aggregation to time
     * @param validator   checks each result, throwing to abort
     * @param <T>         the task's result type
     * @return the recorded timings
     */
    public <T> BenchmarkResult run(String variant, int recordCount, Supplier<T> task, Consumer<? super T> validator) {
        for (int i = 0; i < warmupIterations; i++) {
            validator.accept(task.get());
        }

        List<Long> durations = new ArrayList<>(measuredIterations);
        for (int i = 0; i < measuredIterations; i++) {
            long start = System.nanoTime();
            T result = task.get();
            durations.add(System.nanoTime() - start);
            validator.accept(result);
        }
        return new BenchmarkResult(variant, recordCount, durations);
    }
}
