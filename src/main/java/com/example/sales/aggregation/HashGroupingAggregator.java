package com.example.sales.aggregation;

import com.example.sales.error.DomainViolationException;
import com.example.sales.model.GroupKey;
import com.example.sales.model.GroupStats;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.Product;
import com.example.sales.model.Region;
import com.example.sales.model.SalesRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Groups records by (region, product) in a hash map.
 *
 * <p>This is the general path: it makes no assumption about how many keys
 * exist and would work unchanged for an open-ended dimension. Groups are
 * created on their first record and finalized in first-seen order.
 *
 * <pre>{@code
 * GroupedSales groups = new HashGroupingAggregator().aggregate(records);
 * }</pre>
 */
public class HashGroupingAggregator implements Aggregator<SalesRecord, HashGroupingAggregator.Accumulator, GroupedSales> {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashGroupingAggregator.class);

    /**
     * Group table of a single aggregation call.
     */
    public static class Accumulator {
        private final Map<GroupKey, GroupAccumulator> groups = new LinkedHashMap<>();
        private long recordCount = 0;

        /**
         * Folds one record into its group, creating the group if needed.
         *
         * @throws DomainViolationException if the record's region or product is unknown
         */
        public void accumulate(SalesRecord record) {
            GroupKey key;
            try {
                key = GroupKey.of(Region.fromLabel(record.region()), Product.fromLabel(record.product()));
            } catch (DomainViolationException e) {
                throw e.atRecord(recordCount);
            }
            groups.computeIfAbsent(key, k -> new GroupAccumulator())
                    .add(record.amount(), record.quantity());
            recordCount++;
        }

        /**
         * Merges another partial group table into this one.
         *
         * @return this accumulator
         */
        public Accumulator combine(Accumulator other) {
            other.groups.forEach((key, group) ->
                    groups.merge(key, group.copy(), GroupAccumulator::combine));
            recordCount += other.recordCount;
            return this;
        }

        /**
         * Computes the averages of every group in one pass.
         */
        public GroupedSales finish() {
            Map<GroupKey, GroupStats> finalized = new LinkedHashMap<>();
            groups.forEach((key, group) -> finalized.put(key, group.finish()));
            LOGGER.debug("Finalized {} groups from {} records", finalized.size(), recordCount);
            return GroupedSales.of(finalized);
        }

        public long getRecordCount() {
            return recordCount;
        }

        public int getGroupCount() {
            return groups.size();
        }
    }

    @Override
    public Supplier<Accumulator> supplier() {
        return Accumulator::new;
    }

    @Override
    public BiConsumer<Accumulator, SalesRecord> accumulator() {
        return Accumulator::accumulate;
    }

    @Override
    public BinaryOperator<Accumulator> combiner() {
        return Accumulator::combine;
    }

    @Override
    public Function<Accumulator, GroupedSales> finisher() {
        return Accumulator::finish;
    }
}
