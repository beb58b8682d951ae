package org.analytics.dataquery.rest.service;

import org.analytics.dataquery.model.QueryDocument;
import org.analytics.dataquery.model.RenderMode;
import org.analytics.dataquery.rest.ApiMethod;
import org.analytics.dataquery.rest.DataQueryClient;
import org.analytics.dataquery.rest.ResultPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Fetches single pages of a data query.
 * <p>
 * Every call issues a fresh getData request; pages are never cached. The query
 * document is not modified.
 * </p>
 */
public class PageFetcher {

    private static final Logger logger = LoggerFactory.getLogger(PageFetcher.class);

    private final DataQueryClient client;

    public PageFetcher(DataQueryClient client) {
        this.client = client;
    }

    /**
     * Fetches one page.
     *
     * @param document   query to execute
     * @param pageNumber page to fetch, starting at 1
     * @return decoded page
     * @throws org.analytics.dataquery.rest.exception.DataQueryException as raised by the client
     */
    public ResultPage fetchPage(QueryDocument document, int pageNumber) {
        Map<String, Object> json = document.render(RenderMode.PAGED, pageNumber);
        logger.debug("Fetching page {} (max-results {})", pageNumber, json.get("max-results"));
        Map<String, Object> response = client.request(ApiMethod.GET_DATA, json);
        return new ResultPage(pageNumber, response);
    }
}
