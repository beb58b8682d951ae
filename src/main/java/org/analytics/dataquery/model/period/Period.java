package org.analytics.dataquery.model.period;

import java.util.List;
import java.util.Map;

/**
 * Analysis period of a data query, rendered as {@code p1} or {@code p2} of the period block.
 */
public sealed interface Period permits DayPeriod, RelativePeriod {

    /**
     * Renders this period as a one-element list holding the type discriminator
     * ({@code "D"} or {@code "R"}) and the type-specific fields.
     *
     * @return JSON-serializable list
     */
    List<Map<String, Object>> toJson();

}
