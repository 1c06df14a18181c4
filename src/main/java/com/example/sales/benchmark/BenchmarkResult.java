package com.example.sales.benchmark;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Timings of one benchmarked variant.
 *
 * @param variant        name of the variant (e.g. "dense", "reactor")
 * @param recordCount    records aggregated per iteration
 * @param durationsNanos wall-clock duration of every measured iteration
 */
public record BenchmarkResult(
        String variant,
        int recordCount,
        @JsonIgnore List<Long> durationsNanos
) {
    public BenchmarkResult {
        durationsNanos = List.copyOf(durationsNanos);
    }

    @JsonProperty("iterations")
    public int iterations() {
        return durationsNanos.size();
    }

    /**
     * Fastest iteration in nanoseconds.
     */
    @JsonProperty("minNanos")
    public long minNanos() {
        return durationsNanos.stream().mapToLong(Long::longValue).min().orElse(0);
    }

    /**
     * Mean iteration time in nanoseconds.
     */
    @JsonProperty("meanNanos")
    public double meanNanos() {
        return durationsNanos.stream().mapToLong(Long::longValue).average().orElse(0);
    }

    @JsonProperty("meanMillis")
    public double meanMillis() {
        return meanNanos() / 1_000_000.0;
    }

    /**
     * Mean cost of folding one record, or 0 for an empty dataset.
     */
    @JsonProperty("nanosPerRecord")
    public double nanosPerRecord() {
        return recordCount == 0 ? 0 : meanNanos() / recordCount;
    }
}
