package org.analytics.dataquery.rest.exception;

/**
 * The requested data has not been processed yet.
 */
public class DataNotReadyException extends ServiceException {

    private static final long serialVersionUID = 1L;

    public DataNotReadyException(String message, int statusCode, Integer errorCode) {
        super(message, statusCode, errorCode, "DataNotReady");
    }

}
