package org.carball.deepanalysis.model.metric;

public enum AggregationKind {
    SUM,
    AVG,
    COUNT,
    MIN,
    MAX;

    public static AggregationKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SUM;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
