package org.analytics.dataquery.rest.exception;

/**
 * The analysis period is not valid.
 */
public class InvalidPeriodException extends ServiceException {

    private static final long serialVersionUID = 1L;

    public InvalidPeriodException(String message, int statusCode, Integer errorCode) {
        this(message, statusCode, errorCode, "InvalidPeriod");
    }

    protected InvalidPeriodException(String message, int statusCode, Integer errorCode, String errorName) {
        super(message, statusCode, errorCode, errorName);
    }

}
