package com.example.sales.aggregation;

import com.example.sales.model.GroupStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupAccumulatorTest {

    @Test
    @DisplayName("Folds count and both sums")
    void foldsMeasures() {
        GroupAccumulator acc = new GroupAccumulator();
        acc.add(100.0, 2);
        acc.add(50.0, 1);

        assertThat(acc.getCount()).isEqualTo(2);
        assertThat(acc.getSumAmount()).isEqualTo(150.0);
        assertThat(acc.getSumQuantity()).isEqualTo(3);
    }

    @Test
    @DisplayName("Merged partials average over merged totals, not over partial averages")
    void combineAveragesOverTotals() {
        GroupAccumulator left = new GroupAccumulator();
        left.add(10.0, 1);
        GroupAccumulator right = new GroupAccumulator();
        right.add(20.0, 1);
        right.add(30.0, 4);

        GroupStats stats = left.combine(right).finish();

        // averaging the partial averages would give (10 + 25) / 2 = 17.5
        assertThat(stats.avgAmount()).isEqualTo(20.0);
        assertThat(stats.avgQuantity()).isEqualTo(2.0);
        assertThat(stats.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Copy is independent of the original")
    void copyIsIndependent() {
        GroupAccumulator original = new GroupAccumulator();
        original.add(5.0, 1);

        GroupAccumulator copy = original.copy();
        copy.add(5.0, 1);

        assertThat(original.getCount()).isEqualTo(1);
        assertThat(copy.getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("An accumulator without records cannot be finalized")
    void emptyCannotFinish() {
        assertThatThrownBy(() -> new GroupAccumulator().finish())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Negative and zero measures are accepted")
    void negativeMeasuresAccepted() {
        GroupAccumulator acc = new GroupAccumulator();
        acc.add(100.0, 3);
        acc.add(-40.0, -1);
        acc.add(0.0, 0);

        GroupStats stats = acc.finish();

        assertThat(stats.sumAmount()).isEqualTo(60.0);
        assertThat(stats.sumQuantity()).isEqualTo(2);
        assertThat(stats.avgAmount()).isEqualTo(20.0);
    }
}
