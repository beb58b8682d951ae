package org.analytics.dataquery.model.filter;

import java.util.Map;

/**
 * A filter statement of a data query.
 * <p>
 * Either a single comparison ({@link FilterEndpoint}) or a boolean combination of
 * other filters ({@link FilterList}). Combinations hold filters of this same type,
 * so filters nest to any depth.
 * </p>
 */
public sealed interface Filter permits FilterEndpoint, FilterList {

    /**
     * Renders this filter as the nested structure expected in the {@code filter} block.
     *
     * @return JSON-serializable map
     */
    Map<String, Object> toJson();

}
