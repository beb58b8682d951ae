package org.analytics.dataquery.rest.parser;

import org.analytics.dataquery.rest.exception.ResponseDecodeException;
import org.analytics.dataquery.rest.exception.ServiceException;
import org.analytics.dataquery.rest.interfaces.TransportResponse;
import org.analytics.dataquery.rest.json.JsonResponseDecoder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a service response is a success or an error, and which error.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>body is not a JSON object: {@link ResponseDecodeException} with the raw body as message</li>
 *   <li>body carries error fields: the exception built by the {@link ErrorResponseParserChain}</li>
 *   <li>status is 400 or higher: {@link ServiceException} with the reason phrase</li>
 *   <li>otherwise the decoded body is returned</li>
 * </ol>
 *
 * <p>Transport, HTTP and application failures therefore all surface as subclasses of
 * {@link org.analytics.dataquery.rest.exception.DataQueryException}.</p>
 */
public class ResponseClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ResponseClassifier.class);

    private final JsonResponseDecoder decoder;
    private final ErrorResponseParserChain errorParsers;

    public ResponseClassifier() {
        this(new JsonResponseDecoder(), defaultErrorParsers());
    }

    public ResponseClassifier(JsonResponseDecoder decoder, ErrorResponseParserChain errorParsers) {
        this.decoder = decoder;
        this.errorParsers = errorParsers;
    }

    /**
     * Registers the parsers for both error protocols, legacy first.
     */
    public static ErrorResponseParserChain defaultErrorParsers() {
        return new ErrorResponseParserChain()
                .addParser(new LegacyErrorResponseParser())
                .addParser(new CurrentErrorResponseParser());
    }

    /**
     * Decodes and classifies a raw transport response.
     *
     * @param response status and body returned by the transport
     * @return decoded body of a successful response
     * @throws ResponseDecodeException if the body is not a JSON object
     * @throws ServiceException        if the service reported an error
     */
    public Map<String, Object> classify(TransportResponse response) {
        return classify(response.getStatusCode(), decoder.decode(response.getBody()),
                response.getBody(), response.getReasonPhrase());
    }

    /**
     * Classifies an already decoded response.
     *
     * @param statusCode   HTTP status code
     * @param decoded      decoded body, empty if decoding failed
     * @param rawBody      raw body text
     * @param reasonPhrase reason phrase reported by the transport, may be null
     * @return decoded body of a successful response
     */
    public Map<String, Object> classify(int statusCode, Optional<Map<String, Object>> decoded,
                                        String rawBody, String reasonPhrase) {
        if (decoded.isEmpty()) {
            logger.warn("Could not decode response with status {}: {}", statusCode, StringUtils.abbreviate(rawBody, 200));
            throw new ResponseDecodeException(rawBody, statusCode);
        }

        Map<String, Object> response = decoded.get();
        Optional<ServiceException> error = errorParsers.parse(response, statusCode);
        if (error.isPresent()) {
            logger.warn("Service error (status {}): {}", statusCode, error.get().getMessage());
            throw error.get();
        }

        if (statusCode >= 400) {
            String message = StringUtils.isNotBlank(reasonPhrase)
                    ? String.format("HTTP error %d: %s", statusCode, reasonPhrase)
                    : String.format("HTTP error %d", statusCode);
            logger.warn(message);
            throw new ServiceException(message, statusCode);
        }
        return response;
    }
}
