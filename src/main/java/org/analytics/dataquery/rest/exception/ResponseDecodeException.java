package org.analytics.dataquery.rest.exception;

/**
 * The response body is not a JSON object. The message holds the raw body.
 */
public class ResponseDecodeException extends DataQueryException {

    private static final long serialVersionUID = 1L;

    public ResponseDecodeException(String rawBody, int statusCode) {
        super(rawBody, statusCode);
    }

}
