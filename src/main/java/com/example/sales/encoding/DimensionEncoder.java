package com.example.sales.encoding;

import com.example.sales.error.DomainViolationException;
import com.example.sales.model.GroupKey;
import com.example.sales.model.Product;
import com.example.sales.model.Region;

import java.util.HashMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Maps region and product labels to small dense indices.
 *
 * <p>The lookup tables are built per instance from the {@link Region} and
 * {@link Product} enumerations and never change afterwards, so an encoder can
 * be shared freely between threads. Composite keys are laid out row-major:
 * <pre>{@code
 * flatIndex = regionIndex * productCount + productIndex
 * }</pre>
 */
public final class DimensionEncoder {

    private static final DimensionEncoder STANDARD = new DimensionEncoder();

    private final Map<String, Integer> regionIndex;
    private final Map<String, Integer> productIndex;
    private final Region[] regions;
    private final Product[] products;

    /**
     * Builds an encoder with its own lookup tables. Most callers want {@link #standard()}.
     */
    public DimensionEncoder() {
        this.regions = Region.values();
        this.products = Product.values();
        this.regionIndex = indexLabels(regions.length, i -> regions[i].label());
        this.productIndex = indexLabels(products.length, i -> products[i].label());
    }

    /**
     * Returns the shared encoder for the region and product enumerations.
     */
    public static DimensionEncoder standard() {
        return STANDARD;
    }

    /**
     * @return index in {@code [0, regionCount())}
     * @throws DomainViolationException if the label is not a known region
     */
    public int encodeRegion(String label) {
        Integer index = label == null ? null : regionIndex.get(label);
        if (index == null) {
            throw new DomainViolationException("region", label);
        }
        return index;
    }

    /**
     * @return index in {@code [0, productCount())}
     * @throws DomainViolationException if the label is not a known product
     */
    public int encodeProduct(String label) {
        Integer index = label == null ? null : productIndex.get(label);
        if (index == null) {
            throw new DomainViolationException("product", label);
        }
        return index;
    }

    /**
     * Encodes a (region, product) pair into its slot in a dense group table.
     */
    public int flatIndex(String regionLabel, String productLabel) {
        return encodeRegion(regionLabel) * products.length + encodeProduct(productLabel);
    }

    /**
     * Decodes a slot index back into its group key.
     */
    public GroupKey keyAt(int flatIndex) {
        if (flatIndex < 0 || flatIndex >= slotCount()) {
            throw new IndexOutOfBoundsException("flat index " + flatIndex + " outside [0, " + slotCount() + ")");
        }
        return GroupKey.of(regions[flatIndex / products.length], products[flatIndex % products.length]);
    }

    public int regionCount() {
        return regions.length;
    }

    public int productCount() {
        return products.length;
    }

    /**
     * Number of distinct composite keys, i.e. the size of a dense group table.
     */
    public int slotCount() {
        return regions.length * products.length;
    }

    private static Map<String, Integer> indexLabels(int size, IntFunction<String> labelAt) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < size; i++) {
            index.put(labelAt.apply(i), i);
        }
        return Map.copyOf(index);
    }
}
