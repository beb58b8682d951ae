package org.analytics.dataquery.model.period;

import lombok.Getter;

public enum Granularity {

    YEAR("Y"),
    QUARTER("Q"),
    MONTH("M"),
    WEEK("W"),
    DAY("D");

    @Getter
    private final String symbol;

    Granularity(String symbol) {
        this.symbol = symbol;
    }

}
