package org.analytics.dataquery.model.filter;

import lombok.Getter;

/**
 * Comparison operators of a {@link FilterEndpoint}, with their wire symbols.
 */
public enum FilterOperator {

    /** Integers, strings, dates and booleans. */
    EQUALS("$eq"),
    /** Integers, strings and booleans. */
    NOT_EQUALS("$neq"),
    /** Integers and strings. */
    IN_ARRAY("$in"),
    GREATER("$gt"),
    GREATER_OR_EQUAL("$gte"),
    LOWER("$lt"),
    LOWER_OR_EQUAL("$lte"),
    IS_NULL("$na"),
    IS_UNDEFINED("$undefined"),
    /** Combination of IS_NULL and IS_UNDEFINED. */
    IS_EMPTY("$empty"),
    CONTAINS("$lk"),
    NOT_CONTAINS("$nlk"),
    STARTS_WITH("$start"),
    NOT_STARTS_WITH("$nstart"),
    ENDS_WITH("$end"),
    NOT_ENDS_WITH("$nend"),
    /**
     * Compares a datetime field to the analysis period.
     * Expression is one of {@code start}, {@code end} or {@code all}.
     */
    PERIOD("$period");

    @Getter
    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

}
