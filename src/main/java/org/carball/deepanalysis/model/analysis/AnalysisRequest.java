package org.carball.deepanalysis.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deepanalysis.model.metric.ThresholdBand;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisRequest {
    private String requestId;
    private String metricId;
    private String timeframe;
    private Map<String, Object> filters;
    private Integer targetCount;
    private boolean enablePercentGrowth;

    // Replaces the catalog threshold band for this request only
    private ThresholdBand thresholdOverride;
}
