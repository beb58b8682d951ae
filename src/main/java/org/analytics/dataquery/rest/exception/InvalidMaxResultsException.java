package org.analytics.dataquery.rest.exception;

/**
 * The max-results value is not accepted by the service.
 */
public class InvalidMaxResultsException extends ServiceException {

    private static final long serialVersionUID = 1L;

    public InvalidMaxResultsException(String message, int statusCode, Integer errorCode) {
        super(message, statusCode, errorCode, "InvalidMaxResults");
    }

}
