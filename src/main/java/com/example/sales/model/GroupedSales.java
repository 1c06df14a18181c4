package com.example.sales.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finalized result of one aggregation call: every group that received at
 * least one record, mapped to its statistics.
 *
 * <p>Iteration follows the order in which the producing engine finalized its
 * groups. Instances are immutable.
 */
public final class GroupedSales {

    private static final GroupedSales EMPTY = new GroupedSales(Map.of());

    private final Map<GroupKey, GroupStats> groups;

    private GroupedSales(Map<GroupKey, GroupStats> groups) {
        this.groups = groups;
    }

    /**
     * Wraps finalized groups, keeping the map's iteration order.
     */
    public static GroupedSales of(Map<GroupKey, GroupStats> groups) {
        if (groups.isEmpty()) {
            return EMPTY;
        }
        return new GroupedSales(Collections.unmodifiableMap(new LinkedHashMap<>(groups)));
    }

    public static GroupedSales empty() {
        return EMPTY;
    }

    public Map<GroupKey, GroupStats> asMap() {
        return groups;
    }

    public Set<GroupKey> keys() {
        return groups.keySet();
    }

    public Optional<GroupStats> get(GroupKey key) {
        return Optional.ofNullable(groups.get(key));
    }

    public Optional<GroupStats> get(Region region, Product product) {
        return get(GroupKey.of(region, product));
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * Total number of records across all groups.
     */
    public long totalCount() {
        return groups.values().stream().mapToLong(GroupStats::count).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return groups.equals(((GroupedSales) o).groups);
    }

    @Override
    public int hashCode() {
        return groups.hashCode();
    }

    @Override
    public String toString() {
        return "GroupedSales" + groups;
    }
}
