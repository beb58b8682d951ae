package org.analytics.dataquery.rest.exception;

import lombok.Getter;

/**
 * The service rejected the request: either the HTTP status is 400 or higher, or the
 * body carries an error description.
 * <p>
 * Responses of the legacy protocol name the error ({@code ErrorName}); known names
 * are raised as the subclasses of this exception. Responses of the current protocol
 * only carry a free-form {@code ErrorType}, which is kept in {@link #getErrorType()}.
 * </p>
 */
@Getter
public class ServiceException extends DataQueryException {

    private static final long serialVersionUID = 1L;

    /** Legacy {@code ErrorCode}, null for current protocol responses. */
    private final Integer errorCode;
    /** Legacy {@code ErrorName} or current {@code ErrorType}, null when absent. */
    private final String errorType;

    public ServiceException(String message, int statusCode) {
        this(message, statusCode, null, null);
    }

    public ServiceException(String message, int statusCode, Integer errorCode, String errorType) {
        super(message, statusCode);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

}
