package org.analytics.dataquery.model.period;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Period relative to the current date, e.g. yesterday is {@code (DAY, -1)}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RelativePeriod implements Period {

    private final Granularity granularity;
    /** Offset from the current period. Can be negative. */
    private final int offset;

    public RelativePeriod(Granularity granularity, int offset) {
        this.granularity = Preconditions.checkNotNull(granularity, "Granularity must not be null");
        this.offset = offset;
    }

    @Override
    public List<Map<String, Object>> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", "R");
        json.put("granularity", granularity.getSymbol());
        json.put("offset", offset);
        return List.of(json);
    }
}
