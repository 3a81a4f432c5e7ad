package org.carball.deepanalysis.model.metric;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Green/yellow/red boundaries declared on a metric for one comparator.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ThresholdBand {

    @JsonProperty("comparison_type")
    private ComparatorKind comparator;

    @JsonProperty("green_threshold")
    private Double greenThreshold;

    @JsonProperty("yellow_threshold")
    private Double yellowThreshold;

    @JsonProperty("red_threshold")
    private Double redThreshold;

    // unset reads as non-inverse on a catalog band and keeps the resolved direction on an override
    @JsonProperty("inverse_logic")
    private Boolean inverseLogic;

    @JsonIgnore
    public boolean isInverse() {
        return Boolean.TRUE.equals(inverseLogic);
    }
}
