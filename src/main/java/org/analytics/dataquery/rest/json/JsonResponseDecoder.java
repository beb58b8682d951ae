package org.analytics.dataquery.rest.json;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.spi.json.JsonSmartJsonProvider;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;

import java.util.Map;
import java.util.Optional;

/**
 * Converts between JSON text and the untyped map structures exchanged with the service.
 */
public class JsonResponseDecoder {

    /** Rejects anything RFC 4627 does not allow, including trailing data. */
    private static final Configuration STRICT = Configuration.builder()
            .jsonProvider(new JsonSmartJsonProvider(JSONParser.MODE_RFC4627))
            .build();

    /**
     * Decodes a response body.
     *
     * @param body raw response body
     * @return the decoded JSON object, or empty if the body is blank, malformed or not an object
     */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> decode(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            Object parsed = JsonPath.using(STRICT).parse(body).json();
            if (parsed instanceof Map) {
                return Optional.of((Map<String, Object>) parsed);
            }
            return Optional.empty();
        } catch (InvalidJsonException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Serializes a request document.
     *
     * @param document map of maps, lists, strings, numbers and booleans
     * @return JSON text
     */
    public String encode(Map<String, Object> document) {
        return JSONValue.toJSONString(document);
    }
}
