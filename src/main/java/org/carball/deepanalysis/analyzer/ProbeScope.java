package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ThresholdPolicy;
import org.carball.deepanalysis.model.metric.MetricDefinition;

import java.util.Map;

/**
 * What every probe of one analysis shares.
 *
 * @param baselineTimeframe prior window for period comparisons, null for budget comparisons
 *                          or when no prior window can be derived
 */
public record ProbeScope(
        MetricDefinition metric,
        String measure,
        String timeframe,
        String baselineTimeframe,
        Map<String, Object> filters,
        ThresholdPolicy policy
) {

    public ProbeScope {
        filters = filters != null ? filters : Map.of();
    }
}
