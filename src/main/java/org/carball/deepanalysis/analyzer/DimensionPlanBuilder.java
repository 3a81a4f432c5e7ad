package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.model.analysis.AnalysisPlan;
import org.carball.deepanalysis.model.analysis.AnalysisRequest;
import org.carball.deepanalysis.model.analysis.PlanStep;
import org.carball.deepanalysis.model.metric.MetricDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Chooses which dimensions an analysis probes and lays out one comparison step per dimension.
 */
@Slf4j
public class DimensionPlanBuilder {

    private final DeepAnalysisConfig config;

    public DimensionPlanBuilder(DeepAnalysisConfig config) {
        this.config = config;
    }

    /**
     * Every usable dimension for the metric in probe order, before truncation. Declared
     * dimensions win; identifier and flag-like labels are dropped and the preferred labels
     * move to the front. Metrics without declared dimensions contribute the top level of
     * each hierarchy vector.
     */
    public List<String> enumerateDimensions(MetricDefinition metric) {
        List<String> kept = new ArrayList<>();
        for (String label : metric.dimensions()) {
            if (isUsable(label)) {
                kept.add(label);
            }
        }

        Set<String> ordered = new LinkedHashSet<>();
        if (!kept.isEmpty()) {
            for (String preferred : config.getPreferredDimensions()) {
                kept.stream()
                        .filter(label -> label.equalsIgnoreCase(preferred))
                        .findFirst()
                        .ifPresent(ordered::add);
            }
            ordered.addAll(kept);
        } else {
            for (List<String> levels : metric.hierarchies().values()) {
                ordered.add(levels.get(0));
            }
        }

        if (ordered.isEmpty()) {
            log.warn("No dimensions or hierarchies resolvable for metric {}; plan will be empty", metric.id());
        }
        return new ArrayList<>(ordered);
    }

    public List<String> selectDimensions(MetricDefinition metric, Integer targetCount) {
        List<String> candidates = enumerateDimensions(metric);
        int limit = config.boundTargetCount(targetCount);
        return candidates.size() > limit ? new ArrayList<>(candidates.subList(0, limit)) : candidates;
    }

    public List<PlanStep> buildSteps(List<String> dimensions, String timeframe, Map<String, Object> filters) {
        List<PlanStep> steps = new ArrayList<>();
        if (dimensions == null) {
            return steps;
        }
        int limit = Math.max(1, config.getMaxDimensions());
        for (String dimension : dimensions.subList(0, Math.min(limit, dimensions.size()))) {
            steps.add(PlanStep.groupCompare(dimension, timeframe, copyFilters(filters)));
        }
        return steps;
    }

    public AnalysisPlan plan(MetricDefinition metric, AnalysisRequest request) {
        List<String> dimensions = selectDimensions(metric, request.getTargetCount());
        List<PlanStep> steps = buildSteps(dimensions, request.getTimeframe(), request.getFilters());

        log.info("Planned analysis for {}: timeframe={} dimensions={} steps={}",
                metric.id(), request.getTimeframe(), dimensions.size(), steps.size());

        return AnalysisPlan.builder()
                .metricId(metric.id())
                .timeframe(request.getTimeframe())
                .filters(copyFilters(request.getFilters()))
                .dimensions(dimensions)
                .steps(steps)
                .targetCount(request.getTargetCount())
                .enablePercentGrowth(request.isEnablePercentGrowth())
                .thresholdOverride(request.getThresholdOverride())
                .notes(metric.dimensions().isEmpty() && metric.hasHierarchies()
                        ? "KT analysis seeded from top hierarchy levels."
                        : "KT analysis over declared metric dimensions.")
                .build();
    }

    /**
     * Fills in dimensions and steps a caller left empty. Running it again changes nothing.
     */
    public void backfill(AnalysisPlan plan, MetricDefinition metric) {
        if (!plan.hasDimensions()) {
            plan.setDimensions(selectDimensions(metric, plan.getTargetCount()));
            log.debug("Backfilled {} dimensions for {}", plan.getDimensions().size(), metric.id());
        }
        if (!plan.hasSteps()) {
            plan.setSteps(buildSteps(plan.getDimensions(), plan.getTimeframe(), plan.getFilters()));
        }
    }

    private boolean isUsable(String label) {
        if (label == null || label.isBlank()) {
            return false;
        }
        String lowered = label.toLowerCase(Locale.ROOT);
        return config.getBannedDimensionTerms().stream()
                .noneMatch(term -> lowered.contains(term.toLowerCase(Locale.ROOT)));
    }

    private static Map<String, Object> copyFilters(Map<String, Object> filters) {
        return filters != null ? new LinkedHashMap<>(filters) : new LinkedHashMap<>();
    }
}
