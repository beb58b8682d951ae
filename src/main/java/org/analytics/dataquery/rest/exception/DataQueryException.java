package org.analytics.dataquery.rest.exception;

import lombok.Getter;

/**
 * Base exception for every error raised while querying the data service.
 * <p>
 * All exceptions of the client extend this type, so callers can handle transport
 * failures, undecodable bodies, service errors and unexpected response shapes in
 * one place and tell them apart by subtype.
 * </p>
 */
@Getter
public class DataQueryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** HTTP status code of the response, or 0 when no response was received. */
    private final int statusCode;

    public DataQueryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DataQueryException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
