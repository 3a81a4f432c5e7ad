package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deepanalysis.model.metric.ThresholdBand;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Dimensions and probe steps chosen for one analysis. Dimensions and steps may be
 * backfilled at execution time when the caller hands over an empty plan.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisPlan {

    @JsonProperty("kpi_name")
    private String metricId;

    private String timeframe;

    private Map<String, Object> filters;

    @Builder.Default
    private List<String> dimensions = new ArrayList<>();

    @Builder.Default
    private List<PlanStep> steps = new ArrayList<>();

    private String notes;

    @JsonProperty("target_count")
    private Integer targetCount;

    @JsonProperty("percent_growth_enabled")
    private boolean enablePercentGrowth;

    @JsonProperty("threshold_override")
    private ThresholdBand thresholdOverride;

    public boolean hasDimensions() {
        return dimensions != null && !dimensions.isEmpty();
    }

    public boolean hasSteps() {
        return steps != null && !steps.isEmpty();
    }

    public boolean hasFilters() {
        return filters != null && !filters.isEmpty();
    }
}
