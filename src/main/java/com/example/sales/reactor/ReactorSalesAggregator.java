package com.example.sales.reactor;

import com.example.sales.aggregation.Aggregator;
import com.example.sales.aggregation.DenseGroupingAggregator;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.SalesRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;

/**
 * Partitioned grouping on Project Reactor.
 *
 * <p>The input list is cut into contiguous partitions. Each partition is
 * folded into its own accumulator on a parallel rail, the partial
 * accumulators are merged with the engine's combiner, and the merged table is
 * finalized once:
 * <pre>{@code
 * Flux.fromIterable(partitions)
 *     .parallel().runOn(scheduler)
 *     .map(this::foldPartition)
 *     .reduce(combiner)
 *     .map(finisher)
 * }</pre>
 *
 * <p>No state is shared between partitions while folding.
 *
 * @param <A> the engine's accumulator type
 */
public class ReactorSalesAggregator<A> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReactorSalesAggregator.class);

    private final Aggregator<SalesRecord, A, GroupedSales> engine;
    private final BinaryOperator<A> combiner;
    private final int partitions;
    private final Scheduler scheduler;

    /**
     * Creates a dense-engine aggregator with one partition per available core.
     */
    public static ReactorSalesAggregator<DenseGroupingAggregator.Accumulator> dense() {
        return new ReactorSalesAggregator<>(
                new DenseGroupingAggregator(),
                Runtime.getRuntime().availableProcessors(),
                Schedulers.parallel());
    }

    /**
     * @param engine     a grouping engine that supports combining partial results
     * @param partitions number of partitions, at least 1
     * @param scheduler  scheduler the partitions are folded on
     */
    public ReactorSalesAggregator(Aggregator<SalesRecord, A, GroupedSales> engine, int partitions, Scheduler scheduler) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be at least 1, was " + partitions);
        }
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.combiner = engine.combiner();
        if (combiner == null) {
            throw new IllegalArgumentException("engine does not support combining partial results");
        }
        this.partitions = partitions;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Groups all records. Errors from any partition, such as a
     * {@link com.example.sales.error.DomainViolationException}, terminate the
     * returned Mono.
     *
     * @param records the records to group
     * @return a Mono emitting the finalized groups
     */
    public Mono<GroupedSales> aggregate(List<SalesRecord> records) {
        List<List<SalesRecord>> slices = partition(records, partitions);
        LOGGER.debug("Aggregating {} records in {} partitions", records.size(), slices.size());
        if (slices.isEmpty()) {
            return Mono.fromSupplier(() -> engine.finisher().apply(engine.supplier().get()));
        }
        return Flux.fromIterable(slices)
                .parallel(slices.size())
                .runOn(scheduler)
                .map(this::foldPartition)
                .reduce(combiner)
                .map(engine.finisher());
    }

    private A foldPartition(List<SalesRecord> slice) {
        A acc = engine.supplier().get();
        BiConsumer<A, SalesRecord> accFn = engine.accumulator();
        for (SalesRecord record : slice) {
            accFn.accept(acc, record);
        }
        return acc;
    }

    /**
     * Splits {@code records} into at most {@code count} contiguous, non-empty views.
     */
    static List<List<SalesRecord>> partition(List<SalesRecord> records, int count) {
        List<List<SalesRecord>> slices = new ArrayList<>();
        int size = records.size();
        if (size == 0) {
            return slices;
        }
        int sliceCount = Math.min(count, size);
        int sliceSize = (size + sliceCount - 1) / sliceCount;
        for (int from = 0; from < size; from += sliceSize) {
            slices.add(records.subList(from, Math.min(size, from + sliceSize)));
        }
        return slices;
    }
}
