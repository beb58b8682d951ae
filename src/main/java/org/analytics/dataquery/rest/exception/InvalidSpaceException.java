package org.analytics.dataquery.rest.exception;

/**
 * The site or space identifier is not valid.
 */
public class InvalidSpaceException extends ServiceException {

    private static final long serialVersionUID = 1L;

    public InvalidSpaceException(String message, int statusCode, Integer errorCode) {
        super(message, statusCode, errorCode, "InvalidSpace");
    }

}
