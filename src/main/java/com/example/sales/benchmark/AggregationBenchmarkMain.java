package com.example.sales.benchmark;

import com.example.sales.aggregation.DenseGroupingAggregator;
import com.example.sales.aggregation.HashGroupingAggregator;
import com.example.sales.aggregation.TopGroupSelector;
import com.example.sales.generator.ClosedFormTotals;
import com.example.sales.generator.SalesDataGenerator;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.SalesRecord;
import com.example.sales.oracle.AggregationOracle;
import com.example.sales.oracle.CrossValidator;
import com.example.sales.oracle.OracleResult;
import com.example.sales.oracle.ValidationReport;
import com.example.sales.reactor.ReactorSalesAggregator;
import com.example.sales.streaming.SalesGroupingCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.function.Supplier;

/**
 * Benchmarks the grouping engines on the generated dataset.
 *
 * <p>Usage:
 * <pre>
 * java -cp ... com.example.sales.benchmark.AggregationBenchmarkMain \
 *     --engine=all \
 *     --records=1000000 \
 *     --iterations=5 \
 *     --warmup=1 \
 *     --seed=42
 * </pre>
 *
 * <p>Engine values: hash, dense, collector, reactor, all
 *
 * <p>Every result is checked against the closed-form totals of the dataset.
 * Output is one JSON object per variant on stdout:
 * <pre>
 * {"variant":"dense","recordCount":1000000,"iterations":5,"minNanos":...,"meanNanos":...,"meanMillis":...,"nanosPerRecord":...}
 * </pre>
 */
public class AggregationBenchmarkMain {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        try {
            BenchmarkOptions options = BenchmarkOptions.parse(args);
            for (BenchmarkResult result : run(options)) {
                System.out.println(toJson(result));
            }
        } catch (Exception e) {
            System.err.println("Error running benchmark: " + e.getMessage());
            System.err.println("Usage: java ... AggregationBenchmarkMain [--engine=<name>] [--records=N] "
                    + "[--iterations=N] [--warmup=N] [--seed=N]");
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }

    /**
     * Runs every variant selected by {@code options}.
     *
     * @throws IllegalStateException if a variant returns a result that disagrees with the closed-form totals
     */
    public static List<BenchmarkResult> run(BenchmarkOptions options) {
        List<SalesRecord> records = SalesDataGenerator.createSampleData(options.records(), options.seed());
        AggregationOracle expected = () -> ClosedFormTotals.top(options.records()).map(OracleResult::from);
        CrossValidator validator = new CrossValidator();
        BenchmarkRunner runner = new BenchmarkRunner(options.warmup(), options.iterations());

        return options.variants().stream()
                .map(variant -> runner.run(
                        variant,
                        records.size(),
                        task(variant, records),
                        groups -> check(variant, validator.validate(TopGroupSelector.selectMax(groups), expected))))
                .toList();
    }

    static Supplier<GroupedSales> task(String variant, List<SalesRecord> records) {
        return switch (variant) {
            case "hash" -> {
                HashGroupingAggregator engine = new HashGroupingAggregator();
                yield () -> engine.aggregate(records);
            }
            case "dense" -> {
                DenseGroupingAggregator engine = new DenseGroupingAggregator();
                yield () -> engine.aggregate(records);
            }
            case "collector" -> () -> records.parallelStream().collect(SalesGroupingCollector.dense());
            case "reactor" -> {
                ReactorSalesAggregator<DenseGroupingAggregator.Accumulator> engine = ReactorSalesAggregator.dense();
                yield () -> engine.aggregate(records).block();
            }
            default -> throw new IllegalArgumentException("Unknown engine: " + variant);
        };
    }

    static void check(String variant, ValidationReport report) {
        if (!report.isValid()) {
            throw new IllegalStateException("Variant " + variant + " produced a wrong result: " + report.mismatches());
        }
    }

    private static String toJson(BenchmarkResult result) throws JsonProcessingException {
        return MAPPER.writeValueAsString(result);
    }
}
