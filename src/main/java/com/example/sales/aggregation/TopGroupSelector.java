package com.example.sales.aggregation;

import com.example.sales.error.EmptyAggregationException;
import com.example.sales.model.GroupKey;
import com.example.sales.model.GroupStats;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.TopGroup;

import java.util.Map;
import java.util.Optional;

/**
 * Picks the group with the largest amount sum.
 *
 * <p>When two groups have exactly the same amount sum, the one with the
 * smaller {@link GroupKey} (region first, then product, in declaration order)
 * wins. The result therefore does not depend on the order in which an engine
 * finalized its groups.
 */
public final class TopGroupSelector {

    private TopGroupSelector() {
    }

    /**
     * @return the top group, or empty if {@code groups} has no group
     */
    public static Optional<TopGroup> selectMax(GroupedSales groups) {
        GroupKey bestKey = null;
        GroupStats bestStats = null;
        for (Map.Entry<GroupKey, GroupStats> entry : groups.asMap().entrySet()) {
            if (bestStats == null || beats(entry.getKey(), entry.getValue(), bestKey, bestStats)) {
                bestKey = entry.getKey();
                bestStats = entry.getValue();
            }
        }
        return bestStats == null ? Optional.empty() : Optional.of(new TopGroup(bestKey, bestStats));
    }

    /**
     * @return the top group
     * @throws EmptyAggregationException if {@code groups} has no group
     */
    public static TopGroup requireMax(GroupedSales groups) {
        return selectMax(groups).orElseThrow(EmptyAggregationException::new);
    }

    private static boolean beats(GroupKey key, GroupStats stats, GroupKey bestKey, GroupStats bestStats) {
        int cmp = Double.compare(stats.sumAmount(), bestStats.sumAmount());
        return cmp > 0 || (cmp == 0 && key.compareTo(bestKey) < 0);
    }
}
