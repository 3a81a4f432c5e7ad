package org.carball.deepanalysis.gateway;

import org.carball.deepanalysis.model.metric.MetricDefinition;

import java.util.Optional;

/**
 * Picks the measure column a probe aggregates.
 */
public interface MeasureResolver {

    Optional<String> resolve(MetricDefinition metric);
}
