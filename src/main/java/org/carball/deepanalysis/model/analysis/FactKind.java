package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FactKind {
    METRIC,
    TIMEFRAME,
    FILTERS,
    OVERALL_CHANGE,
    LARGEST_CHANGE,
    NO_SIGNAL,
    MOST_STABLE,
    GROUP,
    BUCKET,
    WITHIN_THRESHOLD,
    DISTRIBUTION,
    QUERY_STATS;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
