package org.analytics.dataquery.rest.exception;

import lombok.Getter;

/**
 * The HTTP request could not be completed (connection, TLS or timeout failure).
 * No response was received, so {@link #getStatusCode()} is 0.
 */
@Getter
public class TransportException extends DataQueryException {

    private static final long serialVersionUID = 1L;

    /** Transport-level error code, 0 when the transport does not report one. */
    private final int code;

    public TransportException(String message, int code) {
        super(message, 0);
        this.code = code;
    }

    public TransportException(String message, int code, Throwable cause) {
        super(message, 0, cause);
        this.code = code;
    }

}
