package org.analytics.dataquery.rest;

import org.analytics.dataquery.model.QueryDocument;
import org.analytics.dataquery.rest.interfaces.PageLoader;

/**
 * Iterable set of result pages. Each iteration starts again at page 1 and fetches
 * every page anew.
 */
public class ResultPageList implements Iterable<ResultPage> {

    private final QueryDocument document;
    private final PageLoader pageLoader;

    public ResultPageList(QueryDocument document, PageLoader pageLoader) {
        this.document = document;
        this.pageLoader = pageLoader;
    }

    @Override
    public PageCursor iterator() {
        return new PageCursor(document, pageLoader);
    }
}
