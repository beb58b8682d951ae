package org.analytics.dataquery.rest;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * A result row together with its position in the whole result set.
 */
@AllArgsConstructor
@Getter
@ToString
public class ResultRow {

    /** Zero-based index across all pages. */
    private final long index;
    private final Map<String, Object> values;

    public Object get(String column) {
        return values.get(column);
    }

}
