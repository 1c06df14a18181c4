package com.example.sales.streaming;

import com.example.sales.aggregation.Aggregator;
import com.example.sales.aggregation.DenseGroupingAggregator;
import com.example.sales.aggregation.HashGroupingAggregator;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.SalesRecord;

import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A {@link Collector} view of a grouping engine, so records can be grouped
 * with {@code Stream.collect}, including on parallel streams.
 *
 * <p>On a parallel stream every split folds into its own group table; the
 * tables are merged by summing counts and sums, and the averages are derived
 * once from the merged totals.
 *
 * <pre>{@code
 * GroupedSales groups = records.parallelStream()
 *     .collect(SalesGroupingCollector.dense());
 * }</pre>
 *
 * <p>Record indices reported by a
 * {@link com.example.sales.error.DomainViolationException} are relative to the
 * split that saw the record.
 *
 * @param <A> the engine's accumulator type
 */
public class SalesGroupingCollector<A> implements Collector<SalesRecord, A, GroupedSales> {

    private final Aggregator<SalesRecord, A, GroupedSales> engine;
    private final BinaryOperator<A> combiner;

    /**
     * @param engine a grouping engine that supports combining partial results
     * @throws IllegalArgumentException if the engine cannot combine accumulators
     */
    public SalesGroupingCollector(Aggregator<SalesRecord, A, GroupedSales> engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.combiner = engine.combiner();
        if (combiner == null) {
            throw new IllegalArgumentException("engine does not support combining partial results");
        }
    }

    /**
     * Collects through the dense (flat array) engine.
     */
    public static SalesGroupingCollector<DenseGroupingAggregator.Accumulator> dense() {
        return new SalesGroupingCollector<>(new DenseGroupingAggregator());
    }

    /**
     * Collects through the hash map engine.
     */
    public static SalesGroupingCollector<HashGroupingAggregator.Accumulator> hash() {
        return new SalesGroupingCollector<>(new HashGroupingAggregator());
    }

    @Override
    public Supplier<A> supplier() {
        return engine.supplier();
    }

    @Override
    public BiConsumer<A, SalesRecord> accumulator() {
        return engine.accumulator();
    }

    @Override
    public BinaryOperator<A> combiner() {
        return combiner;
    }

    @Override
    public Function<A, GroupedSales> finisher() {
        return engine.finisher();
    }

    @Override
    public Set<Characteristics> characteristics() {
        // Grouping is commutative, so encounter order does not matter
        return Set.of(Characteristics.UNORDERED);
    }
}
