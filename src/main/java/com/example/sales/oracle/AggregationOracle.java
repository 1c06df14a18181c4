package com.example.sales.oracle;

import java.util.Optional;

/**
 * An independently computed top group for the dataset under test.
 *
 * <p>Typical sources are a SQL {@code GROUP BY} result exported as JSON, the
 * closed-form totals of the generated dataset, or another engine.
 */
@FunctionalInterface
public interface AggregationOracle {

    /**
     * @return the group with the largest total amount, or empty if the oracle saw no data
     */
    Optional<OracleResult> topGroup();
}
