package com.example.sales.error;

/**
 * Thrown when a record carries a region or product label outside its fixed
 * enumeration. Aborts the aggregation call in progress.
 */
public class DomainViolationException extends AggregationException {

    /** Record index used when the position of the bad record is not known. */
    public static final long UNKNOWN_INDEX = -1;

    private final String dimension;
    private final String value;
    private final long recordIndex;

    public DomainViolationException(String dimension, String value) {
        this(dimension, value, UNKNOWN_INDEX);
    }

    public DomainViolationException(String dimension, String value, long recordIndex) {
        super(buildMessage(dimension, value, recordIndex));
        this.dimension = dimension;
        this.value = value;
        this.recordIndex = recordIndex;
    }

    /**
     * Returns a copy of this exception that also reports the record index.
     */
    public DomainViolationException atRecord(long index) {
        return new DomainViolationException(dimension, value, index);
    }

    public String getDimension() {
        return dimension;
    }

    public String getValue() {
        return value;
    }

    public long getRecordIndex() {
        return recordIndex;
    }

    private static String buildMessage(String dimension, String value, long recordIndex) {
        String message = "Invalid " + dimension + ": " + value;
        return recordIndex == UNKNOWN_INDEX ? message : message + " (record #" + recordIndex + ")";
    }
}
