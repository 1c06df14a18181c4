package com.example.sales.error;

/**
 * Thrown when a top group is requested from an aggregation that produced no groups.
 */
public class EmptyAggregationException extends AggregationException {

    public EmptyAggregationException() {
        super("No groups to select from: the aggregated input was empty");
    }
}
