package org.analytics.dataquery.rest.service;

import org.analytics.dataquery.rest.DataQueryClient;
import org.analytics.dataquery.rest.exception.TransportException;
import org.analytics.dataquery.rest.interfaces.HttpTransport;
import org.analytics.dataquery.rest.interfaces.TransportResponse;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * {@link HttpTransport} backed by Apache HttpClient 5.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute POST requests built by {@link HttpRequestBuilder}</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Return status code and body as-is, without judging the status</li>
 * </ul>
 *
 * <p><b>Note:</b> one client instance is kept for connection pooling; close the
 * transport to release it.</p>
 */
public class HttpClientTransport implements HttpTransport, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientTransport.class);

    private final CloseableHttpClient httpClient;
    private final HttpRequestBuilder requestBuilder;

    public HttpClientTransport(int connectionTimeout, int responseTimeout) {
        this(HttpClientBuilder.create().build(), new HttpRequestBuilder(connectionTimeout, responseTimeout));
    }

    public HttpClientTransport(CloseableHttpClient httpClient, HttpRequestBuilder requestBuilder) {
        this.httpClient = httpClient;
        this.requestBuilder = requestBuilder;
    }

    @Override
    public TransportResponse send(String url, String jsonBody, Map<String, String> headers) throws TransportException {
        HttpPost request = requestBuilder.buildRequest(url, jsonBody, headers);

        if (logger.isDebugEnabled()) {
            logRequest(request, jsonBody);
        }

        try {
            return httpClient.execute(request, response -> {
                int statusCode = response.getCode();

                if (logger.isDebugEnabled()) {
                    logResponse(response, statusCode);
                }

                String responseBody = "";
                HttpEntity entity = response.getEntity();
                if (entity != null) {
                    try (InputStream is = entity.getContent()) {
                        responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                    }
                }
                if (logger.isDebugEnabled()) {
                    logger.debug("Response Body:");
                    logger.debug("{}", responseBody);
                }
                return new TransportResponse(statusCode, response.getReasonPhrase(), responseBody);
            });
        } catch (IOException e) {
            throw new TransportException("Request to " + url + " failed: " + e.getMessage(), 0, e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private void logRequest(HttpPost request, String jsonBody) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        logger.debug("Headers:");
        for (Header header : request.getHeaders()) {
            String value = DataQueryClient.API_KEY_HEADER.equalsIgnoreCase(header.getName()) ? "****" : header.getValue();
            logger.debug("  {}: {}", header.getName(), value);
        }
        logger.debug("Request Body:");
        logger.debug("{}", jsonBody);
    }

    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (Header header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
