package org.analytics.dataquery.model.filter;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single comparison of a property or metric against an expression.
 *
 * <pre>
 * new FilterEndpoint("src", FilterOperator.EQUALS, "Direct traffic")
 * →
 * {"src": {"$eq": "Direct traffic"}}
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FilterEndpoint implements Filter {

    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    /** Property or metric to compare. */
    private final String field;
    private final FilterOperator operator;
    /** Number, string, boolean, date or a collection of those. Dates are sent as ISO strings. */
    private final Object expression;

    public FilterEndpoint(String field, FilterOperator operator, Object expression) {
        Preconditions.checkArgument(field != null && !field.isEmpty(), "Filter field must not be empty");
        this.field = field;
        this.operator = Preconditions.checkNotNull(operator, "Filter operator must not be null");
        Preconditions.checkArgument(isSupported(expression),
                "Unsupported filter expression type: %s", expression == null ? null : expression.getClass().getName());
        this.expression = expression;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> comparison = new LinkedHashMap<>();
        comparison.put(operator.getSymbol(), toJsonValue(expression));
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(field, comparison);
        return json;
    }

    private static boolean isSupported(Object value) {
        if (value == null || value instanceof CharSequence || value instanceof Number
                || value instanceof Boolean || value instanceof TemporalAccessor) {
            return true;
        }
        if (value instanceof Collection) {
            for (Object element : (Collection<?>) value) {
                if (!isSupported(element)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static Object toJsonValue(Object value) {
        if (value instanceof LocalDateTime) {
            return DATETIME_FORMAT.format((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
        }
        if (value instanceof TemporalAccessor || value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Collection) {
            List<Object> values = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                values.add(toJsonValue(element));
            }
            return values;
        }
        return value;
    }
}
