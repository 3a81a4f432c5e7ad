package org.carball.deepanalysis.model.query;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One grouped (or scalar, when {@code dimension} is null) aggregate probe.
 *
 * @param comparator baseline to return alongside the current value, or null for current values only
 * @param rank       ranking to apply, or null for the full group set
 */
@Builder(toBuilder = true)
public record ProbeRequest(
        String metricId,
        String measure,
        String dimension,
        String timeWindow,
        Map<String, Object> filters,
        BaselineComparator comparator,
        RankSpec rank
) {

    public ProbeRequest {
        filters = filters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(filters)) : Map.of();
    }

    public boolean isScalar() {
        return dimension == null;
    }

    public boolean isRanked() {
        return rank != null;
    }
}
