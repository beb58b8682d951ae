package org.analytics.dataquery.rest;

import lombok.Getter;
import org.analytics.dataquery.model.QueryDocument;
import org.analytics.dataquery.rest.exception.DataShapeException;
import org.analytics.dataquery.rest.json.JsonDocumentReader;
import org.analytics.dataquery.rest.service.PageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A query document bound to a client.
 *
 * <p>Gives access to the result as single pages, as an iterable of pages, as an
 * iterable of rows, and to the row count and metric totals of the query.</p>
 *
 * <p>The row count and totals responses are fetched at most once per instance and
 * are never refreshed; create a new request for fresh aggregates. Instances are not
 * thread-safe.</p>
 */
public class DataRequest {

    private static final Logger logger = LoggerFactory.getLogger(DataRequest.class);

    /** Value the service puts in totals that do not apply to a metric. */
    static final String NOT_APPLICABLE = "-";

    private final DataQueryClient client;
    @Getter
    private final QueryDocument document;
    private final PageFetcher pageFetcher;

    private Memoized<Map<String, Object>> rowCountResponse = Memoized.pending();
    private Memoized<Map<String, Object>> totalResponse = Memoized.pending();

    public DataRequest(DataQueryClient client, QueryDocument document) {
        this.client = client;
        this.document = document;
        this.pageFetcher = new PageFetcher(client);
    }

    /**
     * Executes the query for one page. The page may not include all data.
     *
     * @param pageNumber page to fetch, starting at 1
     * @return decoded page
     */
    public ResultPage fetchPage(int pageNumber) {
        return pageFetcher.fetchPage(document, pageNumber);
    }

    /**
     * Returns all pages of the result. Pages are fetched while iterating.
     */
    public ResultPageList getResultPages() {
        return new ResultPageList(document, this::fetchPage);
    }

    /**
     * Returns all rows of the result without having to deal with paging.
     * Pages are fetched while iterating.
     */
    public ResultRowList getResultRows() {
        return new ResultRowList(document, this::fetchPage);
    }

    /**
     * Returns the full getRowCount response. {@code max-results} is ignored by this method.
     */
    public Map<String, Object> getRowCountResponse() {
        if (rowCountResponse.isComputed()) {
            logger.debug("Using cached row count response");
        } else {
            Map<String, Object> response = client.request(ApiMethod.GET_ROW_COUNT, document.renderTotals());
            rowCountResponse = Memoized.computed(Collections.unmodifiableMap(response));
        }
        return rowCountResponse.get();
    }

    /**
     * Returns the number of results for the query, ignoring {@code max-results}.
     *
     * @throws DataShapeException if the response has no {@code RowCounts[0].RowCount}
     */
    public long getRowCount() {
        return new JsonDocumentReader(getRowCountResponse(), ApiMethod.GET_ROW_COUNT.getPath())
                .readLong("$.RowCounts[0].RowCount");
    }

    /**
     * Returns the full getTotal response.
     */
    public Map<String, Object> getTotalResponse() {
        if (totalResponse.isComputed()) {
            logger.debug("Using cached total response");
        } else {
            Map<String, Object> response = client.request(ApiMethod.GET_TOTAL, document.renderTotals());
            totalResponse = Memoized.computed(Collections.unmodifiableMap(response));
        }
        return totalResponse.get();
    }

    /**
     * Returns the total of each metric of the query.
     * Metrics the service reports as not applicable ({@code "-"}) are left out.
     *
     * @return metric name to total, in response order
     * @throws DataShapeException if the response has no first row in {@code DataFeed.Rows}
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getTotal() {
        List<Object> rows = new JsonDocumentReader(getTotalResponse(), ApiMethod.GET_TOTAL.getPath())
                .readList("DataFeed.Rows");
        if (rows.isEmpty() || !(rows.get(0) instanceof Map)) {
            throw DataShapeException.missingField("DataFeed.Rows[0]", ApiMethod.GET_TOTAL.getPath());
        }
        Map<String, Object> totals = new LinkedHashMap<>((Map<String, Object>) rows.get(0));
        totals.values().removeIf(NOT_APPLICABLE::equals);
        return totals;
    }
}
