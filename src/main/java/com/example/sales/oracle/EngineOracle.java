package com.example.sales.oracle;

import com.example.sales.aggregation.Aggregator;
import com.example.sales.aggregation.TopGroupSelector;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.SalesRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Uses one grouping engine as the oracle for another.
 *
 * <p>The aggregation runs lazily, on each call to {@link #topGroup()}.
 */
public class EngineOracle implements AggregationOracle {

    private final Aggregator<SalesRecord, ?, GroupedSales> engine;
    private final Iterable<SalesRecord> records;

    public EngineOracle(Aggregator<SalesRecord, ?, GroupedSales> engine, Iterable<SalesRecord> records) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.records = Objects.requireNonNull(records, "records must not be null");
    }

    @Override
    public Optional<OracleResult> topGroup() {
        return TopGroupSelector.selectMax(engine.aggregate(records)).map(OracleResult::from);
    }
}
