package com.example.sales.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one group: a (region, product) combination.
 *
 * <p>Natural order is region declaration order, then product declaration order,
 * which is also the dense engine's flat-index order.
 */
public record GroupKey(Region region, Product product) implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing(GroupKey::region)
            .thenComparing(GroupKey::product);

    public GroupKey {
        Objects.requireNonNull(region, "region must not be null");
        Objects.requireNonNull(product, "product must not be null");
    }

    public static GroupKey of(Region region, Product product) {
        return new GroupKey(region, product);
    }

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + region.label() + ", " + product.label() + ")";
    }
}
