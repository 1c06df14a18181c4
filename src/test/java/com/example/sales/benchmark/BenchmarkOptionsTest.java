package com.example.sales.benchmark;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkOptionsTest {

    @Test
    @DisplayName("Missing arguments take their defaults")
    void defaults() {
        BenchmarkOptions options = BenchmarkOptions.parse(new String[0]);

        assertThat(options).isEqualTo(new BenchmarkOptions("dense", 1_000_000, 5, 1, 42L));
        assertThat(options.variants()).containsExactly("dense");
    }

    @Test
    @DisplayName("Parses --name=value arguments in any order")
    void parsesArguments() {
        BenchmarkOptions options = BenchmarkOptions.parse(new String[]{
                "--seed=7", "--engine=ALL", "--records=10_000", "--iterations=3", "--warmup=0", "--ignored=x"
        });

        assertThat(options.engine()).isEqualTo("all");
        assertThat(options.records()).isEqualTo(10_000);
        assertThat(options.iterations()).isEqualTo(3);
        assertThat(options.warmup()).isZero();
        assertThat(options.seed()).isEqualTo(7L);
        assertThat(options.variants()).containsExactly("hash", "dense", "collector", "reactor");
    }

    @Test
    @DisplayName("Malformed or out-of-range values are rejected")
    void rejectsBadValues() {
        assertThatThrownBy(() -> BenchmarkOptions.parse(new String[]{"--records=many"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("records");
        assertThatThrownBy(() -> BenchmarkOptions.parse(new String[]{"--engine=duckdb"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown engine: duckdb");
        assertThatThrownBy(() -> BenchmarkOptions.parse(new String[]{"--iterations=0"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BenchmarkOptions.parse(new String[]{"--records=-5"}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
