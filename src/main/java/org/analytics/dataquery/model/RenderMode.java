package org.analytics.dataquery.model;

/**
 * Shapes a {@link QueryDocument} can be rendered into.
 */
public enum RenderMode {

    /** Full data query for the getData method, including paging and sort. */
    PAGED,
    /** Page-agnostic document for getRowCount/getTotal: no sort, max-results or page-num. */
    TOTALS;

    public boolean includesPaging() {
        return this == PAGED;
    }

}
