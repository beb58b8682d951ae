package org.analytics.dataquery.rest.parser;

import org.analytics.dataquery.rest.exception.ServiceException;

import java.util.Map;

/**
 * Recognizes one error protocol of the service and turns its error body into an exception.
 *
 * <p>The service reports errors in two shapes, told apart only by the keys present:</p>
 * <ul>
 *   <li>legacy: {@code ErrorCode}, {@code ErrorMessage}, {@code ErrorName}</li>
 *   <li>current: {@code ErrorMessage} and/or {@code ErrorType}</li>
 * </ul>
 *
 * <p>Use {@link ErrorResponseParserChain} to try parsers in priority order.</p>
 */
public interface ErrorResponseParser {

    /**
     * Checks whether the decoded body is an error in this parser's protocol.
     *
     * @param response decoded response body
     * @return true if this parser recognizes the error fields
     */
    boolean canHandle(Map<String, Object> response);

    /**
     * Builds the exception describing the error.
     *
     * @param response   decoded response body, accepted by {@link #canHandle(Map)}
     * @param statusCode HTTP status code of the response
     * @return exception to raise
     */
    ServiceException toException(Map<String, Object> response, int statusCode);

    /**
     * Returns parser priority for chain ordering. Lower values are checked first.
     *
     * @return priority value (default: 50)
     */
    default int getPriority() {
        return 50;
    }

    /**
     * Returns a human-readable name for this parser, used for logging.
     */
    String getName();

}
