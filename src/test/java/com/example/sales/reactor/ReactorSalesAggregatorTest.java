package com.example.sales.reactor;

import com.example.sales.aggregation.Aggregator;
import com.example.sales.aggregation.DenseGroupingAggregator;
import com.example.sales.aggregation.HashGroupingAggregator;
import com.example.sales.error.DomainViolationException;
import com.example.sales.generator.ClosedFormTotals;
import com.example.sales.generator.SalesDataGenerator;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.SalesRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Tests for {@link ReactorSalesAggregator}.
 *
 * <h2>Key Concepts</h2>
 * <ul>
 *   <li><b>parallel().runOn()</b>: each partition folds on its own rail</li>
 *   <li><b>reduce(combiner)</b>: partial tables merge before finalization</li>
 * </ul>
 */
class ReactorSalesAggregatorTest {

    @Test
    @DisplayName("Partitioned aggregation matches the closed-form totals")
    void partitionedMatchesClosedForm() {
        List<SalesRecord> records = SalesDataGenerator.createSampleData(100_000, 9L);

        StepVerifier.create(ReactorSalesAggregator.dense().aggregate(records))
                .expectNext(ClosedFormTotals.all(100_000))
                .verifyComplete();
    }

    @Test
    @DisplayName("Partition count does not change the result")
    void partitionCountIrrelevant() {
        List<SalesRecord> records = SalesDataGenerator.createSampleData(10_007, 4L);
        GroupedSales sequential = new HashGroupingAggregator().aggregate(records);

        for (int partitions : new int[]{1, 2, 3, 16, 500}) {
            ReactorSalesAggregator<HashGroupingAggregator.Accumulator> aggregator =
                    new ReactorSalesAggregator<>(new HashGroupingAggregator(), partitions, Schedulers.parallel());

            assertThat(aggregator.aggregate(records).block())
                    .as("partitions=%d", partitions)
                    .isEqualTo(sequential);
        }
    }

    @Test
    @DisplayName("Empty input completes with no groups")
    void emptyInput() {
        StepVerifier.create(ReactorSalesAggregator.dense().aggregate(List.of()))
                .assertNext(groups -> assertThat(groups.isEmpty()).isTrue())
                .verifyComplete();
    }

    @Test
    @DisplayName("A bad label in any partition terminates with an error")
    void domainViolationErrors() {
        List<SalesRecord> records = new ArrayList<>(SalesDataGenerator.generate(1_000));
        records.set(700, new SalesRecord("West", "Gadget", 1.0, 1));

        StepVerifier.create(new ReactorSalesAggregator<>(new DenseGroupingAggregator(), 4, Schedulers.parallel())
                        .aggregate(records))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(DomainViolationException.class)
                        .hasMessageContaining("Gadget"))
                .verify();
    }

    @Test
    @DisplayName("Partitions are contiguous, non-empty and cover the input")
    void partitionSlices() {
        List<SalesRecord> records = SalesDataGenerator.generate(10);

        List<List<SalesRecord>> slices = ReactorSalesAggregator.partition(records, 3);

        assertThat(slices).hasSize(3);
        assertThat(slices).extracting(List::size).containsExactly(4, 4, 2);
        assertThat(slices.stream().flatMap(List::stream).toList()).isEqualTo(records);
        assertThat(ReactorSalesAggregator.partition(records, 50)).hasSize(10);
        assertThat(ReactorSalesAggregator.partition(List.of(), 4)).isEmpty();
    }

    @Test
    @DisplayName("More partitions than records yields one record per partition")
    void partitionCountAboveRecordCount() {
        List<SalesRecord> records = SalesDataGenerator.generate(10);

        assertThat(ReactorSalesAggregator.partition(records, Integer.MAX_VALUE))
                .hasSize(10)
                .allSatisfy(slice -> assertThat(slice).hasSize(1));

        ReactorSalesAggregator<DenseGroupingAggregator.Accumulator> aggregator =
                new ReactorSalesAggregator<>(new DenseGroupingAggregator(), Integer.MAX_VALUE, Schedulers.parallel());
        GroupedSales groups = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> aggregator.aggregate(records).block());

        assertThat(groups).isEqualTo(new DenseGroupingAggregator().aggregate(records));
        assertThat(groups.totalCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Invalid construction is rejected")
    void invalidConstruction() {
        Aggregator<SalesRecord, long[], GroupedSales> noCombiner = Aggregator.of(
                () -> new long[1], (acc, r) -> acc[0]++, acc -> GroupedSales.empty());

        assertThatThrownBy(() -> new ReactorSalesAggregator<>(new DenseGroupingAggregator(), 0, Schedulers.parallel()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReactorSalesAggregator<>(noCombiner, 2, Schedulers.parallel()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
