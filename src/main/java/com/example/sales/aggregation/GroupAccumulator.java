package com.example.sales.aggregation;

import com.example.sales.model.GroupStats;

/**
 * Running totals of one group.
 *
 * <p>Only the count and the two sums are kept while folding. Averages are
 * derived once, in {@link #finish()}.
 */
public final class GroupAccumulator {

    private long count;
    private double sumAmount;
    private long sumQuantity;

    /**
     * Folds one record's measures into the totals.
     */
    public void add(double amount, long quantity) {
        count++;
        sumAmount += amount;
        sumQuantity += quantity;
    }

    /**
     * Adds another group's totals to this one.
     *
     * @return this accumulator
     */
    public GroupAccumulator combine(GroupAccumulator other) {
        this.count += other.count;
        this.sumAmount += other.sumAmount;
        this.sumQuantity += other.sumQuantity;
        return this;
    }

    /**
     * Returns a fresh accumulator holding the same totals.
     */
    public GroupAccumulator copy() {
        return new GroupAccumulator().combine(this);
    }

    /**
     * Derives the averages and freezes the totals.
     *
     * @throws IllegalStateException if nothing was folded in
     */
    public GroupStats finish() {
        if (count == 0) {
            throw new IllegalStateException("cannot finalize a group without records");
        }
        return GroupStats.fromTotals(count, sumAmount, sumQuantity);
    }

    public long getCount() {
        return count;
    }

    public double getSumAmount() {
        return sumAmount;
    }

    public long getSumQuantity() {
        return sumQuantity;
    }
}
