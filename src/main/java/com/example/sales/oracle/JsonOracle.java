package com.example.sales.oracle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Oracle backed by aggregate rows exported as a JSON array, for example the
 * output of a SQL engine's {@code GROUP BY region, product}.
 *
 * <p>The export may contain every group or only the top one. The row with the
 * largest {@code total_amount} is the oracle's answer; equal totals are
 * broken by group key order, the same rule the engine's selector applies.
 */
public class JsonOracle implements AggregationOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonOracle.class);

    private static final TypeReference<List<OracleResult>> ROWS = new TypeReference<>() {
    };

    private static final Comparator<OracleResult> BY_TOTAL_AMOUNT = Comparator
            .comparingDouble(OracleResult::totalAmount)
            .thenComparing(OracleResult::groupKey, Comparator.reverseOrder());

    private final List<OracleResult> rows;

    public JsonOracle(List<OracleResult> rows) {
        this.rows = List.copyOf(rows);
    }

    /**
     * Loads the rows from a JSON array.
     *
     * @throws IOException if the input is not a readable array of rows
     */
    public static JsonOracle load(InputStream inputStream) throws IOException {
        return load(new ObjectMapper(), inputStream);
    }

    public static JsonOracle load(ObjectMapper objectMapper, InputStream inputStream) throws IOException {
        List<OracleResult> rows = objectMapper.readValue(inputStream, ROWS);
        LOGGER.debug("Loaded {} oracle rows", rows.size());
        return new JsonOracle(rows);
    }

    public List<OracleResult> rows() {
        return rows;
    }

    @Override
    public Optional<OracleResult> topGroup() {
        return rows.stream().max(BY_TOTAL_AMOUNT);
    }
}
