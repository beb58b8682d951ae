package org.analytics.dataquery.rest.parser;

import org.analytics.dataquery.rest.exception.ServiceException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the {@link ErrorResponseParser} that recognizes a response body.
 *
 * <p>Parsers are checked in priority order (lower priority values first).
 * The first parser that can handle the body produces the exception.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ErrorResponseParserChain chain = new ErrorResponseParserChain()
 *     .addParser(new LegacyErrorResponseParser())
 *     .addParser(new CurrentErrorResponseParser());
 *
 * Optional<ServiceException> error = chain.parse(response, statusCode);
 * }</pre>
 */
public class ErrorResponseParserChain {

    private final List<ErrorResponseParser> parsers = new ArrayList<>();

    /**
     * Adds a parser to the chain.
     * Parsers are sorted by priority after adding.
     *
     * @param parser Parser to add
     * @return This chain instance for method chaining
     */
    public ErrorResponseParserChain addParser(ErrorResponseParser parser) {
        parsers.add(parser);
        parsers.sort(Comparator.comparingInt(ErrorResponseParser::getPriority));
        return this;
    }

    /**
     * Returns the error described by the body, if any parser recognizes one.
     *
     * @param response   decoded response body
     * @param statusCode HTTP status code
     * @return the exception to raise, or empty if the body carries no error fields
     */
    public Optional<ServiceException> parse(Map<String, Object> response, int statusCode) {
        return getParserFor(response).map(parser -> parser.toException(response, statusCode));
    }

    /**
     * Gets the parser that would handle the given body.
     */
    public Optional<ErrorResponseParser> getParserFor(Map<String, Object> response) {
        return parsers.stream()
                .filter(p -> p.canHandle(response))
                .findFirst();
    }

    /**
     * Returns all registered parsers in priority order.
     */
    public List<ErrorResponseParser> getParsers() {
        return new ArrayList<>(parsers);
    }
}
