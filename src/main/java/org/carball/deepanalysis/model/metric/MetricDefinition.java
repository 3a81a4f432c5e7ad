package org.carball.deepanalysis.model.metric;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable description of a monitored metric as declared in the catalog.
 *
 * @param hierarchies vector name to levels ordered coarse to fine, in declaration order
 */
@Builder(toBuilder = true)
public record MetricDefinition(
        String id,
        String name,
        AggregationKind aggregation,
        String measure,
        List<String> dimensions,
        Map<String, List<String>> hierarchies,
        List<ThresholdBand> thresholds,
        String timeBucketDimension,
        ImprovementDirection improvementDirection
) {

    private static final List<String> LOWER_IS_BETTER_TERMS = List.of("expense", "cost", "deduction");

    public MetricDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Metric id must not be blank");
        }
        aggregation = aggregation != null ? aggregation : AggregationKind.SUM;
        dimensions = dimensions != null ? List.copyOf(dimensions) : List.of();
        hierarchies = hierarchies != null ? copyHierarchies(hierarchies) : Map.of();
        thresholds = thresholds != null ? List.copyOf(thresholds) : List.of();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }

    public boolean hasHierarchies() {
        return !hierarchies.isEmpty();
    }

    public Optional<ThresholdBand> thresholdFor(ComparatorKind comparator) {
        return thresholds.stream()
                .filter(t -> t.getComparator() == comparator)
                .findFirst();
    }

    public Optional<String> declaredMeasure() {
        return measure == null || measure.isBlank() ? Optional.empty() : Optional.of(measure);
    }

    /**
     * Declared direction, or one inferred from the metric name when undeclared:
     * expense, cost and deduction metrics improve when they go down.
     */
    public ImprovementDirection resolveImprovementDirection() {
        if (improvementDirection != null) {
            return improvementDirection;
        }
        String label = displayName().toLowerCase(Locale.ROOT);
        boolean lowerIsBetter = LOWER_IS_BETTER_TERMS.stream().anyMatch(label::contains);
        return lowerIsBetter ? ImprovementDirection.LOWER_IS_BETTER : ImprovementDirection.HIGHER_IS_BETTER;
    }

    private static Map<String, List<String>> copyHierarchies(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((vector, levels) -> {
            if (vector != null && levels != null && !levels.isEmpty()) {
                copy.put(vector, List.copyOf(levels));
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
