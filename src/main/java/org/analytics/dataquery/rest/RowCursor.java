package org.analytics.dataquery.rest;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy, restartable cursor over all result rows of a data query, across pages.
 * <p>
 * Only the rows of the current page are held; they are fetched when first needed,
 * which may be by {@link #valid()}, and dropped when the cursor moves past the page.
 * Iteration ends at the first page that has no rows left at the cursor position, or
 * when the page cursor is exhausted.
 * </p>
 * <p>
 * {@link #key()} is the zero-based index of the row across all pages.
 * </p>
 */
public class RowCursor implements Iterator<ResultRow> {

    private final PageCursor pages;
    /** Rows of the current page, null until needed. */
    private List<Map<String, Object>> rows;
    private int rowIndex;
    private long totalIndex;

    public RowCursor(PageCursor pages) {
        this.pages = pages;
        rewind();
    }

    /**
     * Returns true if a row is available at the cursor. May fetch the current page.
     *
     * @throws org.analytics.dataquery.rest.exception.DataQueryException if fetching the page fails
     */
    public boolean valid() {
        return pages.valid() && rowIndex < bufferedRows().size();
    }

    /**
     * Returns the row at the cursor.
     *
     * @throws NoSuchElementException if no row is available
     */
    public ResultRow current() {
        if (!valid()) {
            throw new NoSuchElementException("No row at index " + totalIndex);
        }
        return new ResultRow(totalIndex, bufferedRows().get(rowIndex));
    }

    public long key() {
        return totalIndex;
    }

    /**
     * Moves to the next row, and to the next page once the rows of this page are used up.
     */
    public void advance() {
        rowIndex++;
        totalIndex++;
        if (rowIndex >= bufferedRows().size()) {
            rows = null;
            rowIndex = 0;
            pages.advance();
        }
    }

    /** Goes back to the first row. The first page is fetched again when needed. */
    public void rewind() {
        pages.rewind();
        rows = null;
        rowIndex = 0;
        totalIndex = 0;
    }

    @Override
    public boolean hasNext() {
        return valid();
    }

    @Override
    public ResultRow next() {
        ResultRow row = current();
        advance();
        return row;
    }

    private List<Map<String, Object>> bufferedRows() {
        if (rows == null) {
            rows = pages.current().getRows();
        }
        return rows;
    }
}
