package org.analytics.dataquery.rest.config;

/**
 * Configuration interface for client settings.
 *
 * <p>Abstracts configuration sources (system properties, maps, etc.)
 * to enable testability and flexibility.</p>
 *
 * <p><b>Configuration keys:</b></p>
 * <ul>
 *   <li>dataquery.baseUrl - Base URL of the data API</li>
 *   <li>dataquery.accessKey / dataquery.secretKey - API credentials</li>
 *   <li>dataquery.connectionTimeout / dataquery.responseTimeout - Timeouts in seconds</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * String baseUrl = config.get("dataquery.baseUrl", ClientSettings.DEFAULT_BASE_URL);
 * }</pre>
 */
public interface ClientConfiguration {

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets an integer value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Parsed value or default value
     * @throws IllegalArgumentException if the value is not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration value " + key + " is not an integer: " + value, e);
        }
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
