package com.example.sales.aggregation;

import com.example.sales.encoding.DimensionEncoder;
import com.example.sales.error.DomainViolationException;
import com.example.sales.model.GroupKey;
import com.example.sales.model.GroupStats;
import com.example.sales.model.GroupedSales;
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
 * Groups records into a flat array with one slot per (region, product) pair.
 *
 * <p>Since both dimensions are closed enumerations, the whole key space fits
 * in {@code regionCount * productCount} slots. A record's slot is computed by
 * the {@link DimensionEncoder}, so no hashing happens per record. A
 * {@code null} slot is a group that has not seen a record yet.
 *
 * <p>Groups are finalized in ascending slot order, which is also
 * {@link GroupKey} natural order.
 */
public class DenseGroupingAggregator implements Aggregator<SalesRecord, DenseGroupingAggregator.Accumulator, GroupedSales> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DenseGroupingAggregator.class);

    private final DimensionEncoder encoder;

    public DenseGroupingAggregator() {
        this(DimensionEncoder.standard());
    }

    public DenseGroupingAggregator(DimensionEncoder encoder) {
        this.encoder = encoder;
    }

    /**
     * Slot table of a single aggregation call.
     */
    public static class Accumulator {
        private final DimensionEncoder encoder;
        private final GroupAccumulator[] slots;
        private long recordCount = 0;

        public Accumulator(DimensionEncoder encoder) {
            this.encoder = encoder;
            this.slots = new GroupAccumulator[encoder.slotCount()];
        }

        /**
         * Folds one record into its slot, initializing the slot if needed.
         *
         * @throws DomainViolationException if the record's region or product is unknown
         */
        public void accumulate(SalesRecord record) {
            int index;
            try {
                index = encoder.flatIndex(record.region(), record.product());
            } catch (DomainViolationException e) {
                throw e.atRecord(recordCount);
            }
            GroupAccumulator group = slots[index];
            if (group == null) {
                group = new GroupAccumulator();
                slots[index] = group;
            }
            group.add(record.amount(), record.quantity());
            recordCount++;
        }

        /**
         * Merges another partial slot table into this one, slot by slot.
         *
         * @return this accumulator
         */
        public Accumulator combine(Accumulator other) {
            for (int i = 0; i < slots.length; i++) {
                GroupAccumulator theirs = other.slots[i];
                if (theirs == null) {
                    continue;
                }
                if (slots[i] == null) {
                    slots[i] = theirs.copy();
                } else {
                    slots[i].combine(theirs);
                }
            }
            recordCount += other.recordCount;
            return this;
        }

        /**
         * Computes the averages of every occupied slot in one pass.
         */
        public GroupedSales finish() {
            Map<GroupKey, GroupStats> finalized = new LinkedHashMap<>();
            for (int i = 0; i < slots.length; i++) {
                if (slots[i] != null) {
                    finalized.put(encoder.keyAt(i), slots[i].finish());
                }
            }
            LOGGER.debug("Finalized {} of {} slots from {} records", finalized.size(), slots.length, recordCount);
            return GroupedSales.of(finalized);
        }

        public long getRecordCount() {
            return recordCount;
        }
    }

    @Override
    public Supplier<Accumulator> supplier() {
        return () -> new Accumulator(encoder);
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
