package org.analytics.dataquery.rest;

import com.google.common.base.Preconditions;
import org.analytics.dataquery.model.QueryDocument;
import org.analytics.dataquery.rest.config.ClientConfiguration;
import org.analytics.dataquery.rest.config.ClientSettings;
import org.analytics.dataquery.rest.interfaces.HttpTransport;
import org.analytics.dataquery.rest.interfaces.TransportResponse;
import org.analytics.dataquery.rest.json.JsonResponseDecoder;
import org.analytics.dataquery.rest.parser.ResponseClassifier;
import org.analytics.dataquery.rest.service.HttpClientTransport;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection to the data API.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Serialize request documents and POST them to {@code <baseUrl>/<method>}</li>
 *   <li>Add the credential and content type headers</li>
 *   <li>Classify responses into decoded bodies or exceptions</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * try (DataQueryClient client = DataQueryClient.create(new SystemPropertyConfiguration())) {
 *     DataRequest request = client.newRequest(document);
 *     for (ResultRow row : request.getResultRows()) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * <p>The client holds no per-query state and may be shared; each request blocks until
 * the transport returns.</p>
 */
public class DataQueryClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(DataQueryClient.class);

    public static final String API_KEY_HEADER = "x-api-key";

    private final String baseUrl;
    private final String accessKey;
    private final String secretKey;
    private final HttpTransport transport;
    private final JsonResponseDecoder decoder;
    private final ResponseClassifier classifier;

    public DataQueryClient(ClientSettings settings, HttpTransport transport) {
        this(settings, transport, new ResponseClassifier());
    }

    public DataQueryClient(ClientSettings settings, HttpTransport transport, ResponseClassifier classifier) {
        settings.validate();
        this.baseUrl = StringUtils.removeEnd(settings.getBaseUrl(), "/");
        this.accessKey = settings.getAccessKey();
        this.secretKey = settings.getSecretKey();
        this.transport = Preconditions.checkNotNull(transport, "Transport must not be null");
        this.decoder = new JsonResponseDecoder();
        this.classifier = Preconditions.checkNotNull(classifier, "Classifier must not be null");
    }

    /**
     * Creates a client with the default HTTP transport.
     *
     * @param configuration source of {@link ClientSettings}
     * @return new client; close it to release pooled connections
     */
    public static DataQueryClient create(ClientConfiguration configuration) {
        ClientSettings settings = ClientSettings.from(configuration);
        return new DataQueryClient(settings,
                new HttpClientTransport(settings.getConnectionTimeout(), settings.getResponseTimeout()));
    }

    /**
     * Binds a query document to this client.
     */
    public DataRequest newRequest(QueryDocument document) {
        return new DataRequest(this, document);
    }

    /**
     * Executes one API request.
     *
     * @param method   API method
     * @param document JSON-serializable request document
     * @return decoded response body
     * @throws org.analytics.dataquery.rest.exception.DataQueryException on any transport, decoding or service error
     */
    public Map<String, Object> request(ApiMethod method, Map<String, Object> document) {
        String url = baseUrl + "/" + method.getPath();
        String body = decoder.encode(document);
        logger.debug("POST {}", url);
        TransportResponse response = transport.send(url, body, getHeaders());
        return classifier.classify(response);
    }

    /**
     * Returns the headers for API requests.
     */
    Map<String, String> getHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(API_KEY_HEADER, accessKey + "_" + secretKey);
        headers.put("Content-Type", "application/json");
        return headers;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public void close() throws IOException {
        if (transport instanceof Closeable) {
            ((Closeable) transport).close();
        }
    }
}
