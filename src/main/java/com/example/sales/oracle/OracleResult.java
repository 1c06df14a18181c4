package com.example.sales.oracle;

import com.example.sales.model.GroupKey;
import com.example.sales.model.GroupStats;
import com.example.sales.model.Product;
import com.example.sales.model.Region;
import com.example.sales.model.TopGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One aggregate row produced outside the engine, shaped like the result of
 * <pre>{@code
 * SELECT region, product,
 *        COUNT(*)      AS total_sales,
 *        SUM(amount)   AS total_amount,
 *        AVG(amount)   AS avg_amount,
 *        SUM(quantity) AS total_quantity,
 *        AVG(quantity) AS avg_quantity
 * FROM sales GROUP BY region, product
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OracleResult(
        String region,
        String product,
        long totalSales,
        double totalAmount,
        double avgAmount,
        long totalQuantity,
        double avgQuantity
) {
    @JsonCreator
    public OracleResult(
            @JsonProperty("region") String region,
            @JsonProperty("product") String product,
            @JsonProperty("total_sales") long totalSales,
            @JsonProperty("total_amount") double totalAmount,
            @JsonProperty("avg_amount") double avgAmount,
            @JsonProperty("total_quantity") long totalQuantity,
            @JsonProperty("avg_quantity") double avgQuantity
    ) {
        this.region = Objects.requireNonNull(region, "region must not be null");
        this.product = Objects.requireNonNull(product, "product must not be null");
        this.totalSales = totalSales;
        this.totalAmount = totalAmount;
        this.avgAmount = avgAmount;
        this.totalQuantity = totalQuantity;
        this.avgQuantity = avgQuantity;
    }

    /**
     * Converts an engine result into the oracle row shape.
     */
    public static OracleResult from(TopGroup top) {
        GroupStats stats = top.stats();
        return new OracleResult(
                top.key().region().label(),
                top.key().product().label(),
                stats.count(),
                stats.sumAmount(),
                stats.avgAmount(),
                stats.sumQuantity(),
                stats.avgQuantity()
        );
    }

    /**
     * Resolves the row's labels.
     *
     * @throws com.example.sales.error.DomainViolationException if a label is unknown
     */
    public GroupKey groupKey() {
        return GroupKey.of(Region.fromLabel(region), Product.fromLabel(product));
    }
}
