package com.example.sales.source;

import com.example.sales.model.SalesRecord;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads sales records from a JSON document with Jackson's streaming API.
 *
 * <p>Records are bound one at a time from the array field, so a large export
 * never has to be held as a tree:
 * <pre>{@code
 * {
 *   "records": [
 *     {"region": "West", "product": "Keyboard", "amount": 290.0, "quantity": 10},
 *     {"region": "North", "product": "Laptop", "amount": 100.0, "quantity": 1}
 *   ]
 * }
 * }</pre>
 *
 * <p>Labels are not validated here; an unknown region or product is reported
 * by the engine that aggregates the record.
 */
public class SalesRecordJsonReader {

    private static final String DEFAULT_ARRAY_FIELD = "records";

    private final ObjectMapper objectMapper;
    private final String arrayFieldName;

    public SalesRecordJsonReader() {
        this(new ObjectMapper(), DEFAULT_ARRAY_FIELD);
    }

    /**
     * @param objectMapper   mapper used to bind each record
     * @param arrayFieldName name of the field holding the record array
     */
    public SalesRecordJsonReader(ObjectMapper objectMapper, String arrayFieldName) {
        this.objectMapper = objectMapper;
        this.arrayFieldName = arrayFieldName;
    }

    /**
     * Returns a lazy stream of the records in {@code inputStream}.
     *
     * <p>Close the returned stream to release the parser; this also closes
     * {@code inputStream}. A document without the array field yields an
     * empty stream.
     *
     * @throws IOException if the document cannot be read up to the array
     */
    public Stream<SalesRecord> stream(InputStream inputStream) throws IOException {
        JsonParser parser = objectMapper.getFactory().createParser(inputStream);
        if (!navigateToArray(parser)) {
            parser.close();
            return Stream.empty();
        }
        Spliterator<SalesRecord> spliterator = new RecordSpliterator(parser, objectMapper);
        return StreamSupport.stream(spliterator, false)
                .onClose(() -> close(parser));
    }

    /**
     * Reads every record of the document into a list.
     *
     * @throws IOException if the document cannot be read
     */
    public List<SalesRecord> readAll(InputStream inputStream) throws IOException {
        try (Stream<SalesRecord> records = stream(inputStream)) {
            return records.toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private boolean navigateToArray(JsonParser parser) throws IOException {
        while (parser.nextToken() != null) {
            if (parser.currentToken() == JsonToken.FIELD_NAME
                    && arrayFieldName.equals(parser.currentName())) {
                return parser.nextToken() == JsonToken.START_ARRAY;
            }
        }
        return false;
    }

    private static void close(JsonParser parser) {
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close JSON parser", e);
        }
    }

    /**
     * Binds one array element per advance.
     */
    private static class RecordSpliterator extends Spliterators.AbstractSpliterator<SalesRecord> {

        private final JsonParser parser;
        private final ObjectMapper objectMapper;
        private boolean finished = false;

        RecordSpliterator(JsonParser parser, ObjectMapper objectMapper) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.parser = parser;
            this.objectMapper = objectMapper;
        }

        @Override
        public boolean tryAdvance(Consumer<? super SalesRecord> action) {
            if (finished) {
                return false;
            }
            try {
                JsonToken token = parser.nextToken();
                if (token == null || token == JsonToken.END_ARRAY) {
                    finished = true;
                    return false;
                }
                action.accept(objectMapper.readValue(parser, SalesRecord.class));
                return true;
            } catch (IOException e) {
                finished = true;
                throw new UncheckedIOException("Failed to parse sales record", e);
            }
        }
    }
}
