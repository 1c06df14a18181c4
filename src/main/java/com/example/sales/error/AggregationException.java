package com.example.sales.error;

/**
 * Base type for failures raised while grouping sales records.
 *
 * <p>All failures are data or programming contract violations; none of them
 * is transient, so callers should not retry.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
