package com.example.sales.model;

/**
 * Finalized statistics for one group.
 *
 * <p>Averages are derived from the sums exactly once, when the group is
 * finalized. Instances always describe at least one record.
 */
public record GroupStats(
        long count,
        double sumAmount,
        double avgAmount,
        long sumQuantity,
        double avgQuantity
) {
    public GroupStats {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, was " + count);
        }
    }

    /**
     * Derives the averages from accumulated totals.
     *
     * @param count       number of records in the group, at least 1
     * @param sumAmount   sum of the records' amounts
     * @param sumQuantity sum of the records' quantities
     * @return finalized statistics
     */
    public static GroupStats fromTotals(long count, double sumAmount, long sumQuantity) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1, was " + count);
        }
        return new GroupStats(
                count,
                sumAmount,
                sumAmount / count,
                sumQuantity,
                (double) sumQuantity / count
        );
    }
}
