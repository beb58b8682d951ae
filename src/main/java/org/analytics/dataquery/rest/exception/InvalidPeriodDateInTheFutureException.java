package org.analytics.dataquery.rest.exception;

/**
 * The analysis period ends after the current date.
 */
public class InvalidPeriodDateInTheFutureException extends InvalidPeriodException {

    private static final long serialVersionUID = 1L;

    public InvalidPeriodDateInTheFutureException(String message, int statusCode, Integer errorCode) {
        super(message, statusCode, errorCode, "InvalidPeriod_DateInTheFuture");
    }

}
