package org.analytics.dataquery.rest;

import lombok.Getter;

/**
 * Methods of the data API; each is the last path segment of its endpoint.
 */
public enum ApiMethod {

    GET_DATA("getData"),
    GET_ROW_COUNT("getRowCount"),
    GET_TOTAL("getTotal");

    @Getter
    private final String path;

    ApiMethod(String path) {
        this.path = path;
    }

}
