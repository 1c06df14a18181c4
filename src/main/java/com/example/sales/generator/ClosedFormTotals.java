package com.example.sales.generator;

import com.example.sales.model.GroupKey;
import com.example.sales.model.GroupStats;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.Product;
import com.example.sales.model.Region;
import com.example.sales.model.TopGroup;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exact per-group totals of a {@link SalesDataGenerator} dataset, computed
 * from the generator formula without materializing any record.
 *
 * <p>A group owns exactly one residue {@code c} modulo 20, so its members are
 * the indices {@code c, c + 20, c + 40, ...} below {@code n}. Their quantity
 * is always {@code 1 + c % 10}, and their amounts form an arithmetic series.
 * For {@code n = 1_000_000} the top group is (West, Keyboard) with 50,000
 * records, a quantity sum of 500,000 and an amount sum of 250,009,500,000.
 */
public final class ClosedFormTotals {

    private static final int CYCLE = Region.values().length * Product.values().length;

    private ClosedFormTotals() {
    }

    /**
     * Expected statistics of one group, or empty if no index below {@code n}
     * falls into it.
     */
    public static Optional<GroupStats> forGroup(int n, GroupKey key) {
        int residue = residueOf(key);
        if (residue >= n) {
            return Optional.empty();
        }
        long count = (n - 1L - residue) / CYCLE + 1;
        long indexSum = residue * count + CYCLE * count * (count - 1) / 2;
        double sumAmount = 100.0 * count + 10.0 * indexSum;
        long sumQuantity = count * (1 + residue % 10);
        return Optional.of(GroupStats.fromTotals(count, sumAmount, sumQuantity));
    }

    /**
     * Expected statistics of every non-empty group, in key order.
     */
    public static GroupedSales all(int n) {
        Map<GroupKey, GroupStats> groups = new LinkedHashMap<>();
        for (Region region : Region.values()) {
            for (Product product : Product.values()) {
                GroupKey key = GroupKey.of(region, product);
                forGroup(n, key).ifPresent(stats -> groups.put(key, stats));
            }
        }
        return GroupedSales.of(groups);
    }

    /**
     * Expected top group by amount sum, or empty when {@code n == 0}.
     */
    public static Optional<TopGroup> top(int n) {
        TopGroup best = null;
        for (Map.Entry<GroupKey, GroupStats> entry : all(n).asMap().entrySet()) {
            if (best == null || entry.getValue().sumAmount() > best.stats().sumAmount()) {
                best = new TopGroup(entry.getKey(), entry.getValue());
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * The unique index residue modulo 20 whose records belong to {@code key}.
     */
    static int residueOf(GroupKey key) {
        int regionCount = Region.values().length;
        int productCount = Product.values().length;
        for (int c = 0; c < CYCLE; c++) {
            if (c % regionCount == key.region().ordinal() && c % productCount == key.product().ordinal()) {
                return c;
            }
        }
        throw new IllegalStateException("no residue for " + key);
    }
}
