package com.example.sales.source;

import com.example.sales.aggregation.DenseGroupingAggregator;
import com.example.sales.error.DomainViolationException;
import com.example.sales.model.GroupStats;
import com.example.sales.model.GroupedSales;
import com.example.sales.model.Product;
import com.example.sales.model.Region;
import com.example.sales.model.SalesRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SalesRecordJsonReader}.
 *
 * <p>Fixture {@code sales-records.json} wraps six records in an object with
 * unrelated metadata before and after the array, and every record carries an
 * extra {@code date} field the reader must ignore.
 */
class SalesRecordJsonReaderTest {

    private final SalesRecordJsonReader reader = new SalesRecordJsonReader();

    @Test
    @DisplayName("Reads every record of the fixture")
    void readsFixture() throws IOException {
        try (InputStream in = fixture("sales-records.json")) {
            List<SalesRecord> records = reader.readAll(in);

            assertThat(records).hasSize(6);
            assertThat(records.get(0)).isEqualTo(new SalesRecord("North", "Laptop", 1200.0, 1));
            assertThat(records.get(5)).isEqualTo(new SalesRecord("South", "Phone", 699.0, 1));
        }
    }

    @Test
    @DisplayName("Streams records straight into an engine")
    void streamsIntoEngine() throws IOException {
        try (InputStream in = fixture("sales-records.json");
             Stream<SalesRecord> records = reader.stream(in)) {

            GroupedSales groups = new DenseGroupingAggregator().aggregate(records::iterator);

            assertThat(groups.size()).isEqualTo(4);
            GroupStats westKeyboard = groups.get(Region.WEST, Product.KEYBOARD).orElseThrow();
            assertThat(westKeyboard.count()).isEqualTo(2);
            assertThat(westKeyboard.sumAmount()).isEqualTo(100.0);
            assertThat(westKeyboard.avgQuantity()).isEqualTo(5.0);
        }
    }

    @Test
    @DisplayName("Stream is lazy: consuming only the first record is fine")
    void lazyStream() throws IOException {
        try (Stream<SalesRecord> records = reader.stream(fixture("sales-records.json"))) {
            assertThat(records.findFirst()).contains(new SalesRecord("North", "Laptop", 1200.0, 1));
        }
    }

    @Test
    @DisplayName("A document without the records array yields nothing")
    void missingArray() throws IOException {
        assertThat(reader.readAll(json("{\"rows\": []}"))).isEmpty();
        assertThat(reader.readAll(json("{\"records\": []}"))).isEmpty();
    }

    @Test
    @DisplayName("Custom array field name")
    void customArrayField() throws IOException {
        SalesRecordJsonReader custom = new SalesRecordJsonReader(
                new ObjectMapper(), "sales");

        List<SalesRecord> records = custom.readAll(json(
                "{\"sales\": [{\"region\": \"East\", \"product\": \"Phone\", \"amount\": 5.5, \"quantity\": 2}]}"));

        assertThat(records).containsExactly(new SalesRecord("East", "Phone", 5.5, 2));
    }

    @Test
    @DisplayName("Unknown labels are read as-is and rejected by the engine")
    void unknownLabelsRejectedByEngine() throws IOException {
        List<SalesRecord> records = reader.readAll(json(
                "{\"records\": [{\"region\": \"Unknown\", \"product\": \"Phone\", \"amount\": 1, \"quantity\": 1}]}"));

        assertThat(records).hasSize(1);
        assertThatThrownBy(() -> new DenseGroupingAggregator().aggregate(records))
                .isInstanceOf(DomainViolationException.class);
    }

    @Test
    @DisplayName("Malformed records fail: checked from readAll, unchecked from stream")
    void malformedRecords() throws IOException {
        String missingRegion = "{\"records\": [{\"product\": \"Phone\", \"amount\": 1, \"quantity\": 1}]}";

        assertThatThrownBy(() -> reader.readAll(json(missingRegion)))
                .isInstanceOf(IOException.class);
        try (Stream<SalesRecord> records = reader.stream(json(missingRegion))) {
            assertThatThrownBy(records::toList).isInstanceOf(UncheckedIOException.class);
        }
    }

    private static InputStream fixture(String name) {
        InputStream in = SalesRecordJsonReaderTest.class.getClassLoader().getResourceAsStream(name);
        assertThat(in).as("fixture %s", name).isNotNull();
        return in;
    }

    private static InputStream json(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
