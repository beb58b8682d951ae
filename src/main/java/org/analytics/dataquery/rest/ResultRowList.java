package org.analytics.dataquery.rest;

import org.analytics.dataquery.model.QueryDocument;
import org.analytics.dataquery.rest.interfaces.PageLoader;

/**
 * Iterable set of all result rows, without having to deal with paging.
 * Each iteration starts again at the first row of page 1.
 */
public class ResultRowList implements Iterable<ResultRow> {

    private final QueryDocument document;
    private final PageLoader pageLoader;

    public ResultRowList(QueryDocument document, PageLoader pageLoader) {
        this.document = document;
        this.pageLoader = pageLoader;
    }

    @Override
    public RowCursor iterator() {
        return new RowCursor(new PageCursor(document, pageLoader));
    }
}
