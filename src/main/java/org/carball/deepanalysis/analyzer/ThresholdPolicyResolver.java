package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.model.analysis.ThresholdPolicy;
import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.metric.MetricDefinition;
import org.carball.deepanalysis.model.metric.ThresholdBand;

import java.util.Optional;

/**
 * Resolves the comparator and breach threshold used for one analysis.
 */
@Slf4j
public class ThresholdPolicyResolver {

    public ThresholdPolicy resolve(MetricDefinition metric, String timeframe) {
        return resolve(metric, timeframe, null);
    }

    /**
     * A budget band declared on the metric wins over the window-derived comparator. A request
     * override wins over both, field by field: whatever the override leaves unset, including
     * inverse_logic, keeps the resolved value. Undeclared comparators fall back to yellow = 0,
     * non-inverse.
     */
    public ThresholdPolicy resolve(MetricDefinition metric, String timeframe, ThresholdBand override) {
        ComparatorKind derived = comparatorFor(timeframe);

        Optional<ThresholdBand> band = metric.thresholdFor(ComparatorKind.BUDGET);
        if (band.isEmpty()) {
            band = metric.thresholdFor(derived);
        }

        ThresholdPolicy policy = band
                .map(b -> fromBand(b, derived))
                .orElseGet(() -> {
                    log.debug("No threshold band for {} on metric {}, using defaults", derived, metric.id());
                    return ThresholdPolicy.defaultsFor(derived);
                });

        if (override != null) {
            policy = applyOverride(policy, override);
            log.debug("Applied request threshold override for metric {}: {}", metric.id(), policy);
        }
        return policy;
    }

    /**
     * quarter windows compare QoQ, year windows YoY, everything else MoM.
     */
    public ComparatorKind comparatorFor(String timeframe) {
        if (TimeframeMapper.isQuarterly(timeframe)) {
            return ComparatorKind.QOQ;
        }
        if (TimeframeMapper.isYearly(timeframe)) {
            return ComparatorKind.YOY;
        }
        return ComparatorKind.MOM;
    }

    private ThresholdPolicy fromBand(ThresholdBand band, ComparatorKind fallback) {
        ComparatorKind comparator = band.getComparator() != null ? band.getComparator() : fallback;
        double yellow = band.getYellowThreshold() != null ? band.getYellowThreshold() : 0.0;
        return new ThresholdPolicy(comparator, band.isInverse(), yellow,
                band.getGreenThreshold(), band.getRedThreshold(), true);
    }

    private ThresholdPolicy applyOverride(ThresholdPolicy base, ThresholdBand override) {
        ComparatorKind comparator = override.getComparator() != null ? override.getComparator() : base.comparator();
        double yellow = override.getYellowThreshold() != null ? override.getYellowThreshold() : base.yellowThreshold();
        Double green = override.getGreenThreshold() != null ? override.getGreenThreshold() : base.greenThreshold();
        Double red = override.getRedThreshold() != null ? override.getRedThreshold() : base.redThreshold();
        boolean inverse = override.getInverseLogic() != null ? override.getInverseLogic() : base.inverseLogic();
        return new ThresholdPolicy(comparator, inverse, yellow, green, red, true);
    }
}
