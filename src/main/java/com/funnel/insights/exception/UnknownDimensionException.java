package com.funnel.insights.exception;

/**
 * Thrown when a requested dimension is absent from every record.
 * Only the affected dimension is skipped.
 */
public class UnknownDimensionException extends RuntimeException {

    private final String dimension;
    private final int recordCount;

    public UnknownDimensionException(String dimension, int recordCount) {
        super("Dimension '" + dimension + "' not present in any of " + recordCount + " records");
        this.dimension = dimension;
        this.recordCount = recordCount;
    }

    public String getDimension() {
        return dimension;
    }

    public int getRecordCount() {
        return recordCount;
    }
}
