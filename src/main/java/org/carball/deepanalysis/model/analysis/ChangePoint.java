package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A group or bucket flagged as materially contributing to the deviation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangePoint {

    private String dimension;

    private String key;

    @JsonProperty("current_value")
    private double currentValue;

    @JsonProperty("previous_value")
    private double previousValue;

    private double delta;

    // Only populated when percent growth display is requested
    @JsonProperty("percent_growth")
    private Double percentGrowth;

    public static ChangePoint from(String dimension, GroupComparisonRow row) {
        return ChangePoint.builder()
                .dimension(dimension)
                .key(row.groupKey())
                .currentValue(row.currentValue())
                .previousValue(row.baselineValue())
                .delta(row.delta())
                .build();
    }

    public double absoluteDelta() {
        return Math.abs(delta);
    }
}
