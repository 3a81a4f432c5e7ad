package org.carball.deepanalysis.gateway;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.model.metric.MetricDefinition;

import java.util.Optional;

/**
 * Uses the metric's declared measure, then an explicitly configured fallback column.
 * Without a configured fallback, metrics that declare no measure resolve to nothing and
 * the gateway decides.
 */
@Slf4j
public class DefaultMeasureResolver implements MeasureResolver {

    private final String fallbackMeasure;

    public DefaultMeasureResolver(String fallbackMeasure) {
        this.fallbackMeasure = fallbackMeasure != null && !fallbackMeasure.isBlank() ? fallbackMeasure : null;
    }

    @Override
    public Optional<String> resolve(MetricDefinition metric) {
        Optional<String> declared = metric.declaredMeasure();
        if (declared.isPresent()) {
            return declared;
        }
        if (fallbackMeasure != null) {
            log.debug("Metric {} declares no measure, using configured default '{}'", metric.id(), fallbackMeasure);
        }
        return Optional.ofNullable(fallbackMeasure);
    }
}
