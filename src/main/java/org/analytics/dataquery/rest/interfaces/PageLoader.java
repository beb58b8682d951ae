package org.analytics.dataquery.rest.interfaces;

import org.analytics.dataquery.rest.ResultPage;

/**
 * Loads one page of a data query.
 * <p>
 * Handed to page cursors so they can fetch pages lazily without knowing about the
 * client, the query document or the transport.
 * </p>
 */
@FunctionalInterface
public interface PageLoader {

    /**
     * Fetches the given page from the service.
     *
     * @param pageNumber page number, starting at 1
     * @return decoded page
     */
    ResultPage load(int pageNumber);

}
