package org.analytics.dataquery.rest.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p>Uses {@link System#getProperty(String)} to retrieve configuration values.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("dataquery.accessKey", "my-access-key");
 *
 * ClientConfiguration config = new SystemPropertyConfiguration();
 * String accessKey = config.get("dataquery.accessKey");
 * }</pre>
 */
public class SystemPropertyConfiguration implements ClientConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
