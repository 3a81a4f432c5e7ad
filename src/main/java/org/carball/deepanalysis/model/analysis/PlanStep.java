package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record PlanStep(
        @JsonProperty("type") String type,
        @JsonProperty("dimension") String dimension,
        @JsonProperty("timeframe") String timeframe,
        @JsonProperty("filters") Map<String, Object> filters,
        @JsonProperty("comparison") String comparison
) {

    public static final String GROUP_COMPARE = "group_compare";
    public static final String CURRENT_VS_PREVIOUS = "current_vs_previous";

    public static PlanStep groupCompare(String dimension, String timeframe, Map<String, Object> filters) {
        return new PlanStep(GROUP_COMPARE, dimension, timeframe, filters != null ? filters : Map.of(), CURRENT_VS_PREVIOUS);
    }
}
