package org.analytics.dataquery.model.filter;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boolean combination of filters.
 *
 * <pre>
 * FilterList.and(
 *     new FilterEndpoint("m_visits", FilterOperator.GREATER, 10),
 *     FilterList.or(a, b))
 * →
 * {"$AND": [{"m_visits": {"$gt": 10}}, {"$OR": [..., ...]}]}
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FilterList implements Filter {

    public enum Combinator {
        AND("$AND"),
        OR("$OR");

        @Getter
        private final String symbol;

        Combinator(String symbol) {
            this.symbol = symbol;
        }
    }

    private final Combinator combinator;
    private final List<Filter> filters;

    public FilterList(Combinator combinator, List<? extends Filter> filters) {
        this.combinator = Preconditions.checkNotNull(combinator, "Combinator must not be null");
        // ImmutableList rejects null children
        this.filters = ImmutableList.copyOf(filters);
    }

    public static FilterList and(Filter... filters) {
        return new FilterList(Combinator.AND, List.of(filters));
    }

    public static FilterList or(Filter... filters) {
        return new FilterList(Combinator.OR, List.of(filters));
    }

    @Override
    public Map<String, Object> toJson() {
        List<Object> children = new ArrayList<>(filters.size());
        for (Filter filter : filters) {
            children.add(filter.toJson());
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(combinator.getSymbol(), children);
        return json;
    }
}
