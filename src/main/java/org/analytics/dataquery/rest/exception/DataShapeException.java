package org.analytics.dataquery.rest.exception;

/**
 * A successful response lacks a field the client requires, e.g. {@code DataFeed.Rows}
 * in a data page or {@code RowCounts[0].RowCount} in a row count response.
 */
public class DataShapeException extends DataQueryException {

    private static final long serialVersionUID = 1L;

    public DataShapeException(String message) {
        super(message, 0);
    }

    public DataShapeException(String message, Throwable cause) {
        super(message, 0, cause);
    }

    public static DataShapeException missingField(String path, String method) {
        return new DataShapeException("Response of " + method + " has no field " + path);
    }

}
