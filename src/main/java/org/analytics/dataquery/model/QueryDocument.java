package org.analytics.dataquery.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;
import org.analytics.dataquery.model.filter.Filter;
import org.analytics.dataquery.model.period.Period;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of a data query.
 * <p>
 * The document is immutable and carries no paging state: the page number is passed to
 * {@link #render(RenderMode, int)} by whoever iterates the result, so several iterations
 * over one document never disturb each other.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * QueryDocument document = QueryDocument.builder()
 *     .sites(1)
 *     .columns("date", "m_visits")
 *     .period(new RelativePeriod(Granularity.DAY, -1))
 *     .sort("-m_visits")
 *     .build();
 * Map<String, Object> json = document.render(RenderMode.PAGED, 1);
 * }</pre>
 */
@Getter
@ToString
public final class QueryDocument {

    /** Maximum number of results in one page. */
    public static final int MAX_PAGE_RESULTS = 10000;
    /** Maximum number of pages in a request. */
    public static final int MAX_PAGES = 20;

    private final List<Integer> sites;
    /** Requested properties and metrics; order determines the output column order. */
    private final List<String> columns;
    private final Period period;
    private final Period comparisonPeriod;
    private final Filter metricFilter;
    private final Filter propertyFilter;
    /** Evolution block, sent as-is. */
    private final Map<String, Object> evolution;
    /** Sort keys; a leading {@code -} sorts descending. */
    private final List<String> sort;
    private final int pageSize;
    private final int maxResults;
    private final boolean ignoreNullProperties;

    private QueryDocument(Builder builder) {
        Preconditions.checkArgument(builder.sites != null && !builder.sites.isEmpty(), "At least one site is required");
        Preconditions.checkArgument(builder.columns != null && !builder.columns.isEmpty(), "At least one column is required");
        Preconditions.checkArgument(builder.pageSize > 0 && builder.pageSize <= MAX_PAGE_RESULTS,
                "Page size must be between 1 and %s: %s", MAX_PAGE_RESULTS, builder.pageSize);
        this.sites = ImmutableList.copyOf(builder.sites);
        this.columns = ImmutableList.copyOf(builder.columns);
        this.period = Preconditions.checkNotNull(builder.period, "Period is required");
        this.comparisonPeriod = builder.comparisonPeriod;
        this.metricFilter = builder.metricFilter;
        this.propertyFilter = builder.propertyFilter;
        this.evolution = builder.evolution == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(builder.evolution));
        this.sort = ImmutableList.copyOf(builder.sort);
        this.pageSize = builder.pageSize;
        this.maxResults = builder.maxResults != null ? builder.maxResults : builder.pageSize * MAX_PAGES;
        this.ignoreNullProperties = builder.ignoreNullProperties;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialised with all parameters of this document.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.sites = new ArrayList<>(sites);
        builder.columns = new ArrayList<>(columns);
        builder.period = period;
        builder.comparisonPeriod = comparisonPeriod;
        builder.metricFilter = metricFilter;
        builder.propertyFilter = propertyFilter;
        builder.evolution = evolution;
        builder.sort = new ArrayList<>(sort);
        builder.pageSize = pageSize;
        builder.maxResults = maxResults;
        builder.ignoreNullProperties = ignoreNullProperties;
        return builder;
    }

    /**
     * Number of results requested for the given page:
     * {@code clamp(0, pageSize, maxResults - pageSize * (pageNumber - 1))}.
     *
     * @param pageNumber page number, starting at 1
     * @return per-page limit, 0 when the page lies past the last one
     */
    public int pageResultLimit(int pageNumber) {
        Preconditions.checkArgument(pageNumber >= 1, "Page numbers start at 1: %s", pageNumber);
        long remaining = (long) maxResults - (long) pageSize * (pageNumber - 1);
        return (int) Math.max(0, Math.min(pageSize, remaining));
    }

    /**
     * Returns true if the given page is the page after the last page that can contain results.
     * This is decided from the paging arithmetic only; no request is made.
     */
    public boolean isAfterLastPage(int pageNumber) {
        return pageResultLimit(pageNumber) == 0;
    }

    /**
     * Renders the document into the JSON structure sent to the service.
     *
     * @param mode       {@link RenderMode#PAGED} for getData, {@link RenderMode#TOTALS} for getRowCount/getTotal
     * @param pageNumber page to request; ignored in totals mode
     * @return JSON-serializable map with a stable key order
     */
    public Map<String, Object> render(RenderMode mode, int pageNumber) {
        Map<String, Object> json = new LinkedHashMap<>();

        Map<String, Object> space = new LinkedHashMap<>();
        space.put("s", new ArrayList<>(sites));
        json.put("space", space);
        json.put("columns", new ArrayList<>(columns));

        Map<String, Object> periods = new LinkedHashMap<>();
        periods.put("p1", period.toJson());
        if (comparisonPeriod != null) {
            periods.put("p2", comparisonPeriod.toJson());
        }
        json.put("period", periods);

        if (mode.includesPaging()) {
            json.put("max-results", pageResultLimit(pageNumber));
            json.put("page-num", pageNumber);
        }

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("ignore_null_properties", ignoreNullProperties);
        json.put("options", options);

        Map<String, Object> filters = renderFilters();
        if (!filters.isEmpty()) {
            json.put("filter", filters);
        }
        if (evolution != null) {
            json.put("evo", evolution);
        }
        if (mode.includesPaging() && !sort.isEmpty()) {
            json.put("sort", new ArrayList<>(sort));
        }
        return json;
    }

    /**
     * Renders the page-agnostic document used by getRowCount and getTotal.
     */
    public Map<String, Object> renderTotals() {
        return render(RenderMode.TOTALS, 1);
    }

    private Map<String, Object> renderFilters() {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (metricFilter != null) {
            filters.put("metric", metricFilter.toJson());
        }
        if (propertyFilter != null) {
            filters.put("property", propertyFilter.toJson());
        }
        return filters;
    }

    public static final class Builder {
        private List<Integer> sites;
        private List<String> columns;
        private Period period;
        private Period comparisonPeriod;
        private Filter metricFilter;
        private Filter propertyFilter;
        private Map<String, Object> evolution;
        private List<String> sort = new ArrayList<>();
        private int pageSize = MAX_PAGE_RESULTS;
        private Integer maxResults;
        private boolean ignoreNullProperties;

        private Builder() {
        }

        public Builder sites(Integer... sites) {
            return sites(Arrays.asList(sites));
        }

        public Builder sites(List<Integer> sites) {
            this.sites = new ArrayList<>(sites);
            return this;
        }

        public Builder columns(String... columns) {
            return columns(Arrays.asList(columns));
        }

        public Builder columns(List<String> columns) {
            this.columns = new ArrayList<>(columns);
            return this;
        }

        public Builder period(Period period) {
            this.period = period;
            return this;
        }

        public Builder comparisonPeriod(Period comparisonPeriod) {
            this.comparisonPeriod = comparisonPeriod;
            return this;
        }

        public Builder metricFilter(Filter metricFilter) {
            this.metricFilter = metricFilter;
            return this;
        }

        public Builder propertyFilter(Filter propertyFilter) {
            this.propertyFilter = propertyFilter;
            return this;
        }

        public Builder evolution(Map<String, Object> evolution) {
            this.evolution = evolution;
            return this;
        }

        public Builder sort(String... sort) {
            return sort(Arrays.asList(sort));
        }

        public Builder sort(List<String> sort) {
            this.sort = new ArrayList<>(sort);
            return this;
        }

        /**
         * Rows per page, at most {@link #MAX_PAGE_RESULTS}.
         */
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Maximum number of results over all pages. Defaults to {@code pageSize * MAX_PAGES}.
         * Zero or negative values yield an empty result without any request.
         */
        public Builder maxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder ignoreNullProperties(boolean ignoreNullProperties) {
            this.ignoreNullProperties = ignoreNullProperties;
            return this;
        }

        public QueryDocument build() {
            return new QueryDocument(this);
        }
    }
}
