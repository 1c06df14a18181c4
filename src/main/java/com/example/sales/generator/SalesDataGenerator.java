package com.example.sales.generator;

import com.example.sales.model.Product;
import com.example.sales.model.Region;
import com.example.sales.model.SalesRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds the deterministic synthetic sales dataset.
 *
 * <p>Record {@code i} gets:
 * <ul>
 *   <li>region {@code Region.values()[i % 4]}</li>
 *   <li>product {@code Product.values()[i % 5]}</li>
 *   <li>amount {@code 100.0 + 10.0 * i}</li>
 *   <li>quantity {@code 1 + (i % 10)}</li>
 * </ul>
 *
 * <p>Because 4 and 5 are coprime, every block of 20 consecutive indices covers
 * each (region, product) pair exactly once. See {@link ClosedFormTotals} for the
 * resulting per-group totals.
 */
public final class SalesDataGenerator {

    /** Dataset size used by the benchmark and the closed-form checks. */
    public static final int DEFAULT_RECORD_COUNT = 1_000_000;

    private static final Region[] REGIONS = Region.values();
    private static final Product[] PRODUCTS = Product.values();

    private SalesDataGenerator() {
    }

    /**
     * Generates {@code n} records in index order.
     *
     * @param n number of records, not negative
     * @return a mutable list of records
     */
    public static List<SalesRecord> generate(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("record count must not be negative, was " + n);
        }
        List<SalesRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            records.add(recordAt(i));
        }
        return records;
    }

    /**
     * Returns the record the generator produces at index {@code i}.
     */
    public static SalesRecord recordAt(int i) {
        return SalesRecord.of(
                REGIONS[i % REGIONS.length],
                PRODUCTS[i % PRODUCTS.length],
                100.0 + 10.0 * i,
                1 + (i % 10)
        );
    }

    /**
     * Permutes the records in place with a uniform random permutation.
     */
    public static void shuffle(List<SalesRecord> records, Random random) {
        Collections.shuffle(records, random);
    }

    /**
     * Generates {@code n} records and shuffles them with a seeded random source,
     * so the order is random but reproducible.
     */
    public static List<SalesRecord> createSampleData(int n, long seed) {
        List<SalesRecord> records = generate(n);
        shuffle(records, new Random(seed));
        return records;
    }
}
