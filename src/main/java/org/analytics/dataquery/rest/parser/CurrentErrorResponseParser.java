package org.analytics.dataquery.rest.parser;

import com.google.common.base.Joiner;
import org.analytics.dataquery.rest.exception.ServiceException;

import java.util.Map;

/**
 * Parses errors of the current protocol.
 *
 * <pre>
 * {"ErrorMessage": "bad filter", "ErrorType": "InvalidFilter"}
 * →
 * ServiceException("InvalidFilter: bad filter")
 * </pre>
 *
 * <p>This protocol has no symbolic error names, so the result is always a plain
 * {@link ServiceException} carrying the raw type string.</p>
 */
public class CurrentErrorResponseParser implements ErrorResponseParser {

    static final String ERROR_MESSAGE = "ErrorMessage";
    static final String ERROR_TYPE = "ErrorType";

    private static final Joiner MESSAGE_JOINER = Joiner.on(": ").skipNulls();

    @Override
    public boolean canHandle(Map<String, Object> response) {
        return response.get(ERROR_MESSAGE) != null || response.get(ERROR_TYPE) != null;
    }

    @Override
    public ServiceException toException(Map<String, Object> response, int statusCode) {
        Object type = response.get(ERROR_TYPE);
        Object message = response.get(ERROR_MESSAGE);
        String errorType = type != null ? type.toString() : null;
        String text = MESSAGE_JOINER.join(errorType, message != null ? message.toString() : null);
        return new ServiceException(text, statusCode, null, errorType);
    }

    @Override
    public int getPriority() {
        return 20;
    }

    @Override
    public String getName() {
        return "CurrentErrorResponseParser";
    }
}
