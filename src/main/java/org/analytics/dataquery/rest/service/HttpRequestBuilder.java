package org.analytics.dataquery.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds the HTTP POST requests sent to the data service.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Create the POST request for an endpoint URL</li>
 *   <li>Attach the JSON body as UTF-8</li>
 *   <li>Configure request timeouts</li>
 *   <li>Add headers</li>
 * </ul>
 */
public class HttpRequestBuilder {

    private final int connectionTimeout;
    private final int responseTimeout;

    /**
     * @param connectionTimeout timeout in seconds for obtaining a connection
     * @param responseTimeout   timeout in seconds for receiving the response
     */
    public HttpRequestBuilder(int connectionTimeout, int responseTimeout) {
        this.connectionTimeout = connectionTimeout;
        this.responseTimeout = responseTimeout;
    }

    /**
     * Builds a POST request with a JSON body.
     *
     * @param url      absolute endpoint URL
     * @param jsonBody serialized request document
     * @param headers  headers to set; a Content-Type header here overrides the entity type
     * @return configured request
     */
    public HttpPost buildRequest(String url, String jsonBody, Map<String, String> headers) {
        HttpPost request = new HttpPost(url);
        request.setEntity(new StringEntity(jsonBody, ContentType.APPLICATION_JSON));

        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(connectionTimeout, TimeUnit.SECONDS)
                .setResponseTimeout(responseTimeout, TimeUnit.SECONDS)
                .build());

        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                request.setHeader(header.getKey(), header.getValue());
            }
        }
        return request;
    }
}
