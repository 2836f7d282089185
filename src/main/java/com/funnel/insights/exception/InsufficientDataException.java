package com.funnel.insights.exception;

/**
 * Thrown when records cannot support a baseline: none were supplied, or the
 * total view_item count is zero. Fatal to the analysis run.
 */
public class InsufficientDataException extends RuntimeException {

    private final int recordCount;

    public InsufficientDataException(String message, int recordCount) {
        super(message + " (records=" + recordCount + ")");
        this.recordCount = recordCount;
    }

    public int getRecordCount() {
        return recordCount;
    }
}
