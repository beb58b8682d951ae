package org.analytics.dataquery.rest;

import lombok.Getter;
import org.analytics.dataquery.rest.exception.DataShapeException;
import org.analytics.dataquery.rest.json.JsonDocumentReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One decoded getData response.
 *
 * <pre>
 * {"DataFeed": {"Columns": [...], "Rows": [{...}, ...], "Context": {...}}}
 * </pre>
 *
 * The raw response is kept as returned; the accessors read the data feed fields and
 * raise {@link DataShapeException} when one is missing.
 */
@Getter
public class ResultPage {

    private final int pageNumber;
    private final Map<String, Object> response;

    public ResultPage(int pageNumber, Map<String, Object> response) {
        this.pageNumber = pageNumber;
        this.response = Collections.unmodifiableMap(response);
    }

    /**
     * Result rows of this page, keyed by column name.
     *
     * @throws DataShapeException if the response has no {@code DataFeed.Rows} list of objects
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getRows() {
        List<Object> rows = reader().readList("DataFeed.Rows");
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Object row : rows) {
            if (!(row instanceof Map)) {
                throw new DataShapeException("Row of page " + pageNumber + " is not an object: " + row);
            }
            result.add((Map<String, Object>) row);
        }
        return result;
    }

    /**
     * Column descriptors, in the order the columns were requested.
     */
    public List<Object> getColumns() {
        return reader().readList("DataFeed.Columns");
    }

    public Map<String, Object> getContext() {
        return reader().readObject("DataFeed.Context");
    }

    private JsonDocumentReader reader() {
        return new JsonDocumentReader(response, ApiMethod.GET_DATA.getPath());
    }
}
