package org.analytics.dataquery.rest.exception;

/**
 * The requested sort is not valid.
 */
public class InvalidSortException extends ServiceException {

    private static final long serialVersionUID = 1L;

    public InvalidSortException(String message, int statusCode, Integer errorCode) {
        super(message, statusCode, errorCode, "InvalidSort");
    }

}
