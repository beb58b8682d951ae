package org.analytics.dataquery.rest.json;

import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.JsonPathException;
import org.analytics.dataquery.rest.exception.DataShapeException;

import java.util.List;
import java.util.Map;

/**
 * Reads required fields from a decoded response using JsonPath expressions.
 * <p>
 * A missing field, or a field of an unexpected type, is a {@link DataShapeException}:
 * the service answered successfully but not in the shape the client relies on.
 * </p>
 */
public class JsonDocumentReader {

    private final Object document;
    /** API method that produced the document, for error messages. */
    private final String method;

    public JsonDocumentReader(Object document, String method) {
        this.document = document;
        this.method = method;
    }

    public Object read(String path) {
        if (document == null) {
            throw DataShapeException.missingField(path, method);
        }
        try {
            String jsonPath = path.startsWith("$") ? path : "$." + path;
            return JsonPath.read(document, jsonPath);
        } catch (JsonPathException e) {
            throw new DataShapeException("Response of " + method + " has no field " + path + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public List<Object> readList(String path) {
        Object value = read(path);
        if (!(value instanceof List)) {
            throw new DataShapeException("Field " + path + " of " + method + " response is not a list");
        }
        return (List<Object>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> readObject(String path) {
        Object value = read(path);
        if (!(value instanceof Map)) {
            throw new DataShapeException("Field " + path + " of " + method + " response is not an object");
        }
        return (Map<String, Object>) value;
    }

    public long readLong(String path) {
        Object value = read(path);
        if (!(value instanceof Number)) {
            throw new DataShapeException("Field " + path + " of " + method + " response is not a number");
        }
        return ((Number) value).longValue();
    }
}
