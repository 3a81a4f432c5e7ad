package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ThresholdPolicy;
import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.metric.MetricDefinition;

import java.util.Map;

final class Scopes {

    static final String WINDOW = "2025-03";
    static final String PRIOR_WINDOW = "2025-02";

    private Scopes() {
    }

    static ThresholdPolicy monthOverMonth() {
        return ThresholdPolicy.defaultsFor(ComparatorKind.MOM);
    }

    static ThresholdPolicy budgetInverse() {
        return new ThresholdPolicy(ComparatorKind.BUDGET, true, 0.0, null, null, true);
    }

    static ProbeScope previous(MetricDefinition metric) {
        return new ProbeScope(metric, "Amount", WINDOW, PRIOR_WINDOW, Map.of(), monthOverMonth());
    }

    static ProbeScope budget(MetricDefinition metric) {
        return new ProbeScope(metric, "Amount", WINDOW, null, Map.of(), budgetInverse());
    }
}
