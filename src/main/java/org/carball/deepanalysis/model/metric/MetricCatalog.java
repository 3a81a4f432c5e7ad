package org.carball.deepanalysis.model.metric;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of metric definitions shared by all analyses.
 */
public final class MetricCatalog {

    private final Map<String, MetricDefinition> metricsById;

    public MetricCatalog(Collection<MetricDefinition> metrics) {
        Map<String, MetricDefinition> byId = new LinkedHashMap<>();
        for (MetricDefinition metric : metrics) {
            byId.put(normalize(metric.id()), metric);
        }
        this.metricsById = Collections.unmodifiableMap(byId);
    }

    public static MetricCatalog of(MetricDefinition... metrics) {
        return new MetricCatalog(List.of(metrics));
    }

    /**
     * Looks a metric up by id, falling back to its display name. Both comparisons ignore case.
     */
    public Optional<MetricDefinition> find(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String key = normalize(reference);
        MetricDefinition byId = metricsById.get(key);
        if (byId != null) {
            return Optional.of(byId);
        }
        return metricsById.values().stream()
                .filter(m -> m.name() != null && normalize(m.name()).equals(key))
                .findFirst();
    }

    public Collection<MetricDefinition> getMetrics() {
        return metricsById.values();
    }

    public int size() {
        return metricsById.size();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
