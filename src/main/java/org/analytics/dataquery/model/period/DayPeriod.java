package org.analytics.dataquery.model.period;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Absolute period between two dates, optionally with time of day.
 *
 * <pre>
 * [{"type": "D", "start": "2024-03-01", "end": "2024-03-31"}]
 * </pre>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DayPeriod implements Period {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final LocalDateTime start;
    private final LocalDateTime end;
    /** Whether the time values of start and end are sent. */
    private final boolean includeTime;

    public DayPeriod(LocalDateTime start, LocalDateTime end, boolean includeTime) {
        this.start = Preconditions.checkNotNull(start, "Period start must not be null");
        this.end = Preconditions.checkNotNull(end, "Period end must not be null");
        this.includeTime = includeTime;
    }

    public DayPeriod(LocalDate start, LocalDate end) {
        this(start.atStartOfDay(), end.atStartOfDay(), false);
    }

    /**
     * Creates a period for only the current day.
     *
     * @param clock clock supplying "now"
     * @return period from midnight until now, without time values
     */
    public static DayPeriod today(Clock clock) {
        LocalDateTime now = LocalDateTime.now(clock);
        return new DayPeriod(now.toLocalDate().atStartOfDay(), now, false);
    }

    @Override
    public List<Map<String, Object>> toJson() {
        DateTimeFormatter format = includeTime ? DATETIME_FORMAT : DATE_FORMAT;
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", "D");
        json.put("start", format.format(start));
        json.put("end", format.format(end));
        return List.of(json);
    }
}
