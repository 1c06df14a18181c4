package com.example.sales.oracle;

import com.example.sales.model.GroupStats;
import com.example.sales.model.TopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares an engine's top group with an oracle's.
 *
 * <p>Labels, record count and quantity sum must match exactly. The amount sum
 * and both averages are floating point and may have been accumulated in a
 * different order, so they only need to agree within a relative tolerance.
 */
public class CrossValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CrossValidator.class);

    /** Default relative tolerance for floating-point fields. */
    public static final double DEFAULT_TOLERANCE = 1e-9;

    private final double tolerance;

    public CrossValidator() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * @param tolerance maximum relative difference accepted for floating-point fields
     */
    public CrossValidator(double tolerance) {
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must not be negative, was " + tolerance);
        }
        this.tolerance = tolerance;
    }

    /**
     * Compares {@code actual} with the oracle's answer.
     *
     * <p>An oracle without an answer is a mismatch when {@code actual} is present,
     * and vice versa; both empty is valid.
     */
    public ValidationReport validate(Optional<TopGroup> actual, AggregationOracle oracle) {
        Optional<OracleResult> expected = oracle.topGroup();
        if (actual.isEmpty() && expected.isEmpty()) {
            return new ValidationReport(List.of());
        }
        if (actual.isEmpty()) {
            return report(List.of("engine produced no group, oracle expected " + describe(expected.get())));
        }
        if (expected.isEmpty()) {
            return report(List.of("oracle produced no group, engine returned " + actual.get().key()));
        }
        return compare(actual.get(), expected.get());
    }

    /**
     * Compares {@code actual} field by field with {@code expected}.
     */
    public ValidationReport compare(TopGroup actual, OracleResult expected) {
        List<String> mismatches = new ArrayList<>();
        GroupStats stats = actual.stats();
        String region = actual.key().region().label();
        String product = actual.key().product().label();

        if (!region.equals(expected.region())) {
            mismatches.add("region: expected " + expected.region() + " but was " + region);
        }
        if (!product.equals(expected.product())) {
            mismatches.add("product: expected " + expected.product() + " but was " + product);
        }
        if (stats.count() != expected.totalSales()) {
            mismatches.add("total_sales: expected " + expected.totalSales() + " but was " + stats.count());
        }
        if (stats.sumQuantity() != expected.totalQuantity()) {
            mismatches.add("total_quantity: expected " + expected.totalQuantity() + " but was " + stats.sumQuantity());
        }
        checkClose(mismatches, "total_amount", expected.totalAmount(), stats.sumAmount());
        checkClose(mismatches, "avg_amount", expected.avgAmount(), stats.avgAmount());
        checkClose(mismatches, "avg_quantity", expected.avgQuantity(), stats.avgQuantity());
        return report(mismatches);
    }

    /**
     * Whether two values agree within the relative tolerance. Values below 1.0
     * in magnitude are compared with the tolerance as an absolute bound.
     */
    public boolean isClose(double expected, double actual) {
        if (Double.compare(expected, actual) == 0) {
            return true;
        }
        double scale = Math.max(1.0, Math.max(Math.abs(expected), Math.abs(actual)));
        return Math.abs(expected - actual) <= tolerance * scale;
    }

    public double getTolerance() {
        return tolerance;
    }

    private void checkClose(List<String> mismatches, String field, double expected, double actual) {
        if (!isClose(expected, actual)) {
            mismatches.add(field + ": expected " + expected + " but was " + actual
                    + " (relative tolerance " + tolerance + ")");
        }
    }

    private static ValidationReport report(List<String> mismatches) {
        if (!mismatches.isEmpty()) {
            LOGGER.warn("Cross-validation failed: {}", mismatches);
        }
        return new ValidationReport(mismatches);
    }

    private static String describe(OracleResult result) {
        return "(" + result.region() + ", " + result.product() + ")";
    }
}
