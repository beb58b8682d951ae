package org.analytics.dataquery.rest;

import org.analytics.dataquery.model.QueryDocument;
import org.analytics.dataquery.rest.interfaces.PageLoader;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy, restartable cursor over the pages of a data query.
 * <p>
 * The cursor owns its page number. Whether a page exists is decided from the paging
 * arithmetic of the {@link QueryDocument} alone, so {@link #valid()} never makes a
 * request; the contents of fetched pages are not inspected.
 * </p>
 * <p>
 * {@link #current()} fetches the current page on every call. Used as an
 * {@link Iterator}, each page is fetched exactly once.
 * </p>
 */
public class PageCursor implements Iterator<ResultPage> {

    private final QueryDocument document;
    private final PageLoader pageLoader;
    private int pageNumber = 1;

    public PageCursor(QueryDocument document, PageLoader pageLoader) {
        this.document = document;
        this.pageLoader = pageLoader;
    }

    /**
     * Returns true while the current page can hold results.
     */
    public boolean valid() {
        return !document.isAfterLastPage(pageNumber);
    }

    /**
     * Fetches the current page.
     *
     * @throws NoSuchElementException if the cursor is exhausted
     */
    public ResultPage current() {
        if (!valid()) {
            throw new NoSuchElementException("No page " + pageNumber + ": result is limited to "
                    + document.getMaxResults() + " rows");
        }
        return pageLoader.load(pageNumber);
    }

    /** Current page number, starting at 1. */
    public int key() {
        return pageNumber;
    }

    public void advance() {
        pageNumber++;
    }

    /** Goes back to the first page. Nothing is fetched. */
    public void rewind() {
        pageNumber = 1;
    }

    @Override
    public boolean hasNext() {
        return valid();
    }

    @Override
    public ResultPage next() {
        ResultPage page = current();
        advance();
        return page;
    }
}
