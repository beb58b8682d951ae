package org.analytics.dataquery.rest.interfaces;

import org.analytics.dataquery.rest.exception.TransportException;

import java.util.Map;

/**
 * Sends one JSON request to the data service.
 * <p>
 * Implementations only move bytes: they return whatever status and body the server
 * produced, including error statuses. Interpreting the response is left to the
 * {@link org.analytics.dataquery.rest.parser.ResponseClassifier}.
 * </p>
 */
public interface HttpTransport {

    /**
     * POSTs a JSON body to the given URL.
     *
     * @param url      absolute endpoint URL
     * @param jsonBody serialized request document
     * @param headers  request headers, including credentials and content type
     * @return status code, reason phrase and raw body of the response
     * @throws TransportException if the request could not be completed
     */
    TransportResponse send(String url, String jsonBody, Map<String, String> headers) throws TransportException;

}
