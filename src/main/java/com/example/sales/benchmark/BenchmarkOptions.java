package com.example.sales.benchmark;

import java.util.List;

/**
 * Settings of one benchmark invocation, parsed from {@code --name=value} arguments.
 *
 * @param engine     variant to run: hash, dense, collector, reactor or all
 * @param records    size of the generated dataset
 * @param iterations measured iterations per variant
 * @param warmup     unmeasured iterations before measuring
 * @param seed       seed of the dataset shuffle
 */
public record BenchmarkOptions(
        String engine,
        int records,
        int iterations,
        int warmup,
        long seed
) {
    static final String DEFAULT_ENGINE = "dense";
    static final int DEFAULT_RECORDS = 1_000_000;
    static final int DEFAULT_ITERATIONS = 5;
    static final int DEFAULT_WARMUP = 1;
    static final long DEFAULT_SEED = 42L;

    static final List<String> ENGINES = List.of("hash", "dense", "collector", "reactor");

    public BenchmarkOptions {
        if (!"all".equals(engine) && !ENGINES.contains(engine)) {
            throw new IllegalArgumentException("Unknown engine: " + engine
                    + ". Valid values: " + String.join(", ", ENGINES) + ", all");
        }
        if (records < 0) {
            throw new IllegalArgumentException("records must not be negative, was " + records);
        }
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be at least 1, was " + iterations);
        }
        if (warmup < 0) {
            throw new IllegalArgumentException("warmup must not be negative, was " + warmup);
        }
    }

    /**
     * Parses {@code --engine=}, {@code --records=}, {@code --iterations=},
     * {@code --warmup=} and {@code --seed=}; missing arguments take their defaults.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static BenchmarkOptions parse(String[] args) {
        return new BenchmarkOptions(
                parseStringArg(args, "engine", DEFAULT_ENGINE).toLowerCase(),
                parseIntArg(args, "records", DEFAULT_RECORDS),
                parseIntArg(args, "iterations", DEFAULT_ITERATIONS),
                parseIntArg(args, "warmup", DEFAULT_WARMUP),
                parseLongArg(args, "seed", DEFAULT_SEED)
        );
    }

    /**
     * Variants selected by {@link #engine()}, in run order.
     */
    public List<String> variants() {
        return "all".equals(engine) ? ENGINES : List.of(engine);
    }

    private static int parseIntArg(String[] args, String name, int defaultValue) {
        String value = parseStringArg(args, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    private static long parseLongArg(String[] args, String name, long defaultValue) {
        String value = parseStringArg(args, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    private static String parseStringArg(String[] args, String name, String defaultValue) {
        String prefix = "--" + name + "=";
        for (String arg : args) {
            if (arg.startsWith(prefix)) {
                return arg.substring(prefix.length());
            }
        }
        return defaultValue;
    }
}
