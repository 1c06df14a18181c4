package com.example.sales.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single sale as delivered by a record source.
 *
 * <p>Region and product are kept as raw labels. They are only checked against
 * {@link Region} and {@link Product} when the record is aggregated, so a bad
 * upstream value surfaces as a
 * {@link com.example.sales.error.DomainViolationException} with the record's
 * position instead of failing somewhere inside the source.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SalesRecord(
        String region,
        String product,
        double amount,
        long quantity
) {
    @JsonCreator
    public SalesRecord(
            @JsonProperty("region") String region,
            @JsonProperty("product") String product,
            @JsonProperty("amount") double amount,
            @JsonProperty("quantity") long quantity
    ) {
        this.region = Objects.requireNonNull(region, "region must not be null");
        this.product = Objects.requireNonNull(product, "product must not be null");
        this.amount = amount;
        this.quantity = quantity;
    }

    /**
     * Creates a record from typed dimensions.
     */
    public static SalesRecord of(Region region, Product product, double amount, long quantity) {
        return new SalesRecord(region.label(), product.label(), amount, quantity);
    }
}
