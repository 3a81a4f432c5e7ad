package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deepanalysis.model.metric.ComparatorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Spread of variance ratios over every group of one probed level.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DistributionSummary {

    private String dimension;

    private ComparatorKind comparator;

    private double threshold;

    @JsonProperty("inverse_logic")
    private boolean inverseLogic;

    @JsonProperty("total_keys")
    private int totalKeys;

    @JsonProperty("breach_count")
    private int breachCount;

    @JsonProperty("within_count")
    private int withinCount;

    // bin label to count, in ascending ratio order
    @Builder.Default
    private Map<String, Integer> histogram = new LinkedHashMap<>();

    @JsonProperty("min_ratio")
    private Double minRatio;

    @JsonProperty("median_ratio")
    private Double medianRatio;

    @JsonProperty("max_ratio")
    private Double maxRatio;

    public boolean hasBreaches() {
        return breachCount > 0;
    }
}
