package org.analytics.dataquery.rest.parser;

import org.analytics.dataquery.rest.exception.DataNotReadyException;
import org.analytics.dataquery.rest.exception.InvalidMaxResultsException;
import org.analytics.dataquery.rest.exception.InvalidPeriodDateInTheFutureException;
import org.analytics.dataquery.rest.exception.InvalidPeriodException;
import org.analytics.dataquery.rest.exception.InvalidSortException;
import org.analytics.dataquery.rest.exception.InvalidSpaceException;
import org.analytics.dataquery.rest.exception.ServiceException;

import java.util.Map;

/**
 * Parses errors of the legacy protocol.
 *
 * <pre>
 * {"ErrorCode": 12, "ErrorMessage": "...", "ErrorName": "InvalidSort"}
 * </pre>
 *
 * <p>Known error names map to the specific {@link ServiceException} subclasses;
 * other names give a plain {@link ServiceException}.</p>
 */
public class LegacyErrorResponseParser implements ErrorResponseParser {

    static final String ERROR_CODE = "ErrorCode";
    static final String ERROR_MESSAGE = "ErrorMessage";
    static final String ERROR_NAME = "ErrorName";

    @Override
    public boolean canHandle(Map<String, Object> response) {
        return response.get(ERROR_CODE) != null || response.get(ERROR_NAME) != null;
    }

    @Override
    public ServiceException toException(Map<String, Object> response, int statusCode) {
        Integer errorCode = toErrorCode(response.get(ERROR_CODE));
        Object name = response.get(ERROR_NAME);
        String errorName = name != null ? name.toString() : null;
        Object messageValue = response.get(ERROR_MESSAGE);
        String message;
        if (messageValue != null) {
            message = messageValue.toString();
        } else if (errorName != null) {
            message = errorName;
        } else {
            message = "Error " + errorCode;
        }

        if (errorName == null) {
            return new ServiceException(message, statusCode, errorCode, null);
        }
        switch (errorName) {
            case "InvalidSort":
                return new InvalidSortException(message, statusCode, errorCode);
            case "InvalidMaxResults":
                return new InvalidMaxResultsException(message, statusCode, errorCode);
            case "DataNotReady":
                return new DataNotReadyException(message, statusCode, errorCode);
            case "InvalidPeriod":
                return new InvalidPeriodException(message, statusCode, errorCode);
            case "InvalidPeriod_DateInTheFuture":
                return new InvalidPeriodDateInTheFutureException(message, statusCode, errorCode);
            case "InvalidSpace":
                return new InvalidSpaceException(message, statusCode, errorCode);
            default:
                return new ServiceException(message, statusCode, errorCode, errorName);
        }
    }

    private Integer toErrorCode(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value != null) {
            try {
                return Integer.valueOf(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public String getName() {
        return "LegacyErrorResponseParser";
    }
}
