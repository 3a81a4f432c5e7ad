package org.carball.deepanalysis.model.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular probe result. Rows are positional and follow {@code columns}.
 */
public record ProbeResponse(List<String> columns, List<List<Object>> rows) {

    public static final String GROUP_KEY = "group_key";
    public static final String CURRENT_VALUE = "current_value";
    public static final String BASELINE_VALUE = "baseline_value";
    public static final String DELTA = "delta_vs_baseline";

    public ProbeResponse {
        columns = columns != null ? List.copyOf(columns) : List.of();
        List<List<Object>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<Object> row : rows) {
                // rows may hold nulls, so List.copyOf is not an option
                copy.add(row != null ? Collections.unmodifiableList(new ArrayList<>(row)) : List.of());
            }
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static ProbeResponse empty() {
        return new ProbeResponse(List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Position of the first column whose name matches one of {@code names}, else {@code fallbackPosition}
     * when the response is wide enough, else -1.
     */
    public int indexOf(int fallbackPosition, String... names) {
        for (String name : names) {
            int idx = columns.indexOf(name);
            if (idx >= 0) {
                return idx;
            }
        }
        return fallbackPosition < columns.size() ? fallbackPosition : -1;
    }
}
