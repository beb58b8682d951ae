package org.analytics.dataquery.rest.config;

import lombok.Data;
import lombok.ToString;

/**
 * Settings of a {@link org.analytics.dataquery.rest.DataQueryClient}.
 */
@Data
public class ClientSettings {

    public static final String BASE_URL = "dataquery.baseUrl";
    public static final String ACCESS_KEY = "dataquery.accessKey";
    public static final String SECRET_KEY = "dataquery.secretKey";
    public static final String CONNECTION_TIMEOUT = "dataquery.connectionTimeout";
    public static final String RESPONSE_TIMEOUT = "dataquery.responseTimeout";

    public static final String DEFAULT_BASE_URL = "https://api.atinternet.io/v3/data";
    public static final int DEFAULT_CONNECTION_TIMEOUT = 10;
    public static final int DEFAULT_RESPONSE_TIMEOUT = 60;

    private String baseUrl = DEFAULT_BASE_URL;
    private String accessKey;
    @ToString.Exclude
    private String secretKey;
    /** Seconds. */
    private int connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    /** Seconds. */
    private int responseTimeout = DEFAULT_RESPONSE_TIMEOUT;

    /**
     * Reads settings from a configuration source.
     *
     * @param configuration configuration source
     * @return settings with defaults for absent keys
     * @throws IllegalArgumentException if a credential is missing or a timeout is not a number
     */
    public static ClientSettings from(ClientConfiguration configuration) {
        ClientSettings settings = new ClientSettings();
        settings.setBaseUrl(configuration.get(BASE_URL, DEFAULT_BASE_URL));
        settings.setAccessKey(configuration.get(ACCESS_KEY));
        settings.setSecretKey(configuration.get(SECRET_KEY));
        settings.setConnectionTimeout(configuration.getInt(CONNECTION_TIMEOUT, DEFAULT_CONNECTION_TIMEOUT));
        settings.setResponseTimeout(configuration.getInt(RESPONSE_TIMEOUT, DEFAULT_RESPONSE_TIMEOUT));
        settings.validate();
        return settings;
    }

    public void validate() {
        if (accessKey == null || accessKey.isBlank()) {
            throw new IllegalArgumentException("Missing configuration value " + ACCESS_KEY);
        }
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("Missing configuration value " + SECRET_KEY);
        }
    }
}
