package com.example.sales.aggregation;

import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Folds the items of an {@link Iterable} into a single result in one pass.
 *
 * <p>This mirrors {@link java.util.stream.Collector} for plain iteration. An
 * aggregation has three phases:
 * <ol>
 *   <li><b>Initialization:</b> a fresh mutable accumulator from {@link #supplier()}</li>
 *   <li><b>Folding:</b> every item goes through {@link #accumulator()}</li>
 *   <li><b>Finalization:</b> {@link #finisher()} turns the accumulator into the result</li>
 * </ol>
 *
 * <p>Each call to {@link #aggregate(Iterable)} owns its accumulator, so one
 * aggregator instance can serve concurrent calls over independent inputs.
 *
 * <pre>{@code
 * Aggregator<SalesRecord, ?, GroupedSales> engine = new DenseGroupingAggregator();
 * GroupedSales groups = engine.aggregate(records);
 * }</pre>
 *
 * @param <T> the type of input elements
 * @param <A> the mutable accumulator type
 * @param <R> the result type
 */
public interface Aggregator<T, A, R> {

    /**
     * @return a supplier of new, empty accumulators
     */
    Supplier<A> supplier();

    /**
     * @return a function folding one element into an accumulator
     */
    BiConsumer<A, T> accumulator();

    /**
     * @return a function turning a fully folded accumulator into the result
     */
    Function<A, R> finisher();

    /**
     * Merges two partial accumulators, for partitioned aggregation.
     *
     * <p>Returns {@code null} by default, meaning the aggregator is sequential only.
     *
     * @return a function combining two accumulators, or {@code null} if not supported
     */
    default BinaryOperator<A> combiner() {
        return null;
    }

    /**
     * Aggregates every item of {@code source}.
     *
     * @param source the items to aggregate
     * @return the finalized result
     */
    default R aggregate(Iterable<? extends T> source) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            accFn.accept(acc, item);
        }
        return finisher().apply(acc);
    }

    /**
     * Aggregates only the items of {@code source} accepted by {@code filter}.
     *
     * <pre>{@code
     * GroupedSales west = engine.aggregateFiltered(records, r -> "West".equals(r.region()));
     * }</pre>
     *
     * @param source the items to aggregate
     * @param filter selects the items to include
     * @return the finalized result over the selected items
     */
    default R aggregateFiltered(Iterable<? extends T> source, Predicate<? super T> filter) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            if (filter.test(item)) {
                accFn.accept(acc, item);
            }
        }
        return finisher().apply(acc);
    }

    /**
     * Creates an ad-hoc aggregator from its three phases. The result does not
     * support combining.
     *
     * <pre>{@code
     * Aggregator<SalesRecord, long[], Long> totalQuantity = Aggregator.of(
     *     () -> new long[1],
     *     (acc, r) -> acc[0] += r.quantity(),
     *     acc -> acc[0]
     * );
     * }</pre>
     */
    static <T, A, R> Aggregator<T, A, R> of(
            Supplier<A> supplier,
            BiConsumer<A, T> accumulator,
            Function<A, R> finisher) {
        return new Aggregator<>() {
            @Override
            public Supplier<A> supplier() {
                return supplier;
            }

            @Override
            public BiConsumer<A, T> accumulator() {
                return accumulator;
            }

            @Override
            public Function<A, R> finisher() {
                return finisher;
            }
        };
    }
}
