package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.gateway.DefaultMeasureResolver;
import org.carball.deepanalysis.gateway.MeasureResolver;
import org.carball.deepanalysis.gateway.MetricQueryGateway;
import org.carball.deepanalysis.gateway.ProbeResult;
import org.carball.deepanalysis.gateway.ProbeRunner;
import org.carball.deepanalysis.model.analysis.AnalysisPlan;
import org.carball.deepanalysis.model.analysis.AnalysisRequest;
import org.carball.deepanalysis.model.analysis.AnalysisResult;
import org.carball.deepanalysis.model.analysis.AnalysisStatus;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.EvidenceTable;
import org.carball.deepanalysis.model.analysis.EvidenceTable.Slot;
import org.carball.deepanalysis.model.analysis.FactKind;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;
import org.carball.deepanalysis.model.analysis.ThresholdPolicy;
import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.metric.MetricCatalog;
import org.carball.deepanalysis.model.metric.MetricDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of the engine: plans an analysis for a catalog metric, drills the data through
 * the gateway and assembles the Is/Is-Not evidence.
 * <p>
 * Only an unknown metric fails a request. Probe failures shrink the evidence instead.
 */
@Slf4j
public class DeepAnalyzer {

    private final MetricCatalog catalog;
    private final MetricQueryGateway gateway;
    private final DeepAnalysisConfig config;
    private final MeasureResolver measureResolver;
    private final DimensionPlanBuilder planBuilder;
    private final ThresholdPolicyResolver policyResolver;
    private final EvidenceAssembler assembler;

    public DeepAnalyzer(MetricCatalog catalog, MetricQueryGateway gateway) {
        this(catalog, gateway, DeepAnalysisConfig.defaults());
    }

    public DeepAnalyzer(MetricCatalog catalog, MetricQueryGateway gateway, DeepAnalysisConfig config) {
        this(catalog, gateway, config, new DefaultMeasureResolver(config.getDefaultMeasure()));
    }

    public DeepAnalyzer(MetricCatalog catalog, MetricQueryGateway gateway, DeepAnalysisConfig config,
                        MeasureResolver measureResolver) {
        this.catalog = catalog;
        this.gateway = gateway;
        this.config = config;
        this.measureResolver = measureResolver;
        this.planBuilder = new DimensionPlanBuilder(config);
        this.policyResolver = new ThresholdPolicyResolver();
        this.assembler = new EvidenceAssembler();

        config.validate();
        log.info("Initialized DeepAnalyzer with {} catalog metrics", catalog.size());
    }

    /**
     * Candidate dimensions for the request's metric, filtered and ordered but not truncated.
     * Empty when the metric is unknown.
     */
    public List<String> enumerateDimensions(AnalysisRequest request) {
        Optional<MetricDefinition> metric = lookup(request.getMetricId());
        if (metric.isEmpty()) {
            log.warn("Cannot enumerate dimensions: unknown metric '{}'", request.getMetricId());
            return List.of();
        }
        return planBuilder.enumerateDimensions(metric.get());
    }

    public Optional<AnalysisPlan> plan(AnalysisRequest request) {
        return lookup(request.getMetricId()).map(metric -> planBuilder.plan(metric, request));
    }

    public AnalysisResult analyze(AnalysisRequest request) {
        String requestId = requestId(request.getRequestId());
        Optional<MetricDefinition> metric = lookup(request.getMetricId());
        if (metric.isEmpty()) {
            return unknownMetric(requestId, request.getMetricId());
        }
        return execute(requestId, planBuilder.plan(metric.get(), request));
    }

    public AnalysisResult execute(AnalysisPlan plan) {
        return execute(null, plan);
    }

    public AnalysisResult execute(String requestId, AnalysisPlan plan) {
        String id = requestId(requestId);
        Optional<MetricDefinition> metric = lookup(plan.getMetricId());
        if (metric.isEmpty()) {
            return unknownMetric(id, plan.getMetricId());
        }

        try {
            return run(id, metric.get(), plan);
        } catch (RuntimeException e) {
            log.error("Deep analysis {} for {} failed", id, plan.getMetricId(), e);
            return AnalysisResult.error(id, "Analysis failed: " + e.getMessage());
        }
    }

    private AnalysisResult run(String requestId, MetricDefinition metric, AnalysisPlan plan) {
        log.info("Starting deep analysis {} for {} over {}", requestId, metric.id(), plan.getTimeframe());

        // Step 1: Complete the plan and resolve the comparison
        planBuilder.backfill(plan, metric);
        ThresholdPolicy policy = policyResolver.resolve(metric, plan.getTimeframe(), plan.getThresholdOverride());
        String baselineTimeframe = policy.comparator() == ComparatorKind.BUDGET
                ? null
                : TimeframeMapper.previous(plan.getTimeframe()).orElse(null);
        ProbeScope scope = new ProbeScope(metric, measureResolver.resolve(metric).orElse(null),
                plan.getTimeframe(), baselineTimeframe, plan.getFilters(), policy);
        log.debug("Resolved policy {} with baseline window {}", policy, baselineTimeframe);

        ProbeRunner runner = new ProbeRunner(gateway, config.getProbeDeadline());
        GroupComparisonFetcher fetcher = new GroupComparisonFetcher(runner, config);
        EvidenceTable table = new EvidenceTable();

        // Step 2: Overall movement of the metric
        ProbeResult<GroupComparisonRow> overall = fetcher.overall(scope);
        if (overall.isSuccess()) {
            table.append(Slot.EXTENT_IS, overallFact(overall.get()));
        } else {
            log.debug("Overall probe unavailable: {}", overall.failureReason());
        }

        // Step 3: Where - hierarchy drill, flat ranking when it finds nothing
        DrillOutcome where = new DrillOutcome();
        if (metric.hasHierarchies()) {
            where.addAll(new HierarchicalDrillEngine(fetcher, config)
                    .drill(metric.hierarchies(), scope, runner.remaining()));
        }
        if (!where.hasChangePoints()) {
            if (metric.hasHierarchies()) {
                log.info("No hierarchy level breached for {}, falling back to flat ranking", metric.id());
            }
            where.addAll(new FlatDrillFallback(fetcher, config)
                    .drill(plan.getDimensions(), scope, config.boundTargetCount(plan.getTargetCount())));
        }
        table.appendAll(Slot.WHERE_IS, where.getIsFacts());
        table.appendAll(Slot.WHERE_IS_NOT, where.getIsNotFacts());

        // Step 4: When - bucket comparison along the time dimension
        DrillOutcome when = new TemporalDrill(fetcher, config).drill(scope);
        table.appendAll(Slot.WHEN_IS, when.getIsFacts());
        table.appendAll(Slot.WHEN_IS_NOT, when.getIsNotFacts());

        table.appendAll(Slot.EXTENT_IS, where.getExtentIs());
        table.appendAll(Slot.EXTENT_IS, when.getExtentIs());
        table.appendAll(Slot.EXTENT_IS_NOT, where.getExtentIsNot());
        table.appendAll(Slot.EXTENT_IS_NOT, when.getExtentIsNot());
        table.append(Slot.EXTENT_IS, queryStats(runner, plan));

        // Step 5: Derive the what rows and the narrative
        List<ChangePoint> changePoints = new ArrayList<>(where.getChangePoints());
        if (plan.isEnablePercentGrowth()) {
            changePoints.forEach(cp -> cp.setPercentGrowth(
                    VarianceMath.percentGrowth(cp.getCurrentValue(), cp.getPreviousValue())));
        }

        EvidenceAssembler.Assessment assessment = assembler.assemble(table, changePoints,
                new EvidenceAssembler.AssemblyContext(metric.displayName(), plan.getTimeframe(), baselineTimeframe,
                        plan.hasFilters(), metric.resolveImprovementDirection(), policy.comparator()));
        table.appendAll(Slot.WHAT_IS, assessment.whatIs());
        table.appendAll(Slot.WHAT_IS_NOT, assessment.whatIsNot());

        Map<String, String> timeframeMapping = new LinkedHashMap<>();
        timeframeMapping.put(AnalysisResult.CURRENT, plan.getTimeframe());
        timeframeMapping.put(AnalysisResult.BASELINE,
                policy.comparator() == ComparatorKind.BUDGET ? config.getBudgetVersion() : baselineTimeframe);

        log.info("Deep analysis {} finished: {} change points, {} probes executed, {} failed",
                requestId, changePoints.size(), runner.getExecutedCount(), runner.getFailedCount());

        return AnalysisResult.builder()
                .requestId(requestId)
                .status(AnalysisStatus.SUCCESS)
                .plan(plan)
                .dimensionsSuggested(new ArrayList<>(plan.getDimensions()))
                .evidence(table)
                .changePoints(changePoints)
                .narrative(assessment.narrative())
                .timeframeMapping(timeframeMapping)
                .whenStarted(assessment.whenStarted())
                .stoppingLevels(new LinkedHashMap<>(where.getStoppingLevels()))
                .comparator(policy.comparator())
                .percentGrowthEnabled(plan.isEnablePercentGrowth())
                .build();
    }

    private static EvidenceFact overallFact(GroupComparisonRow row) {
        return EvidenceFact.builder()
                .kind(FactKind.OVERALL_CHANGE)
                .key(row.groupKey())
                .current(row.currentValue())
                .previous(row.baselineValue())
                .delta(row.delta())
                .ratio(row.ratio())
                .build();
    }

    /**
     * Probes that returned data, or the planned step count when none did.
     */
    private static EvidenceFact queryStats(ProbeRunner runner, AnalysisPlan plan) {
        int executed = runner.getExecutedCount();
        int planned = executed > 0 ? executed : plan.getSteps().size();
        EvidenceFact fact = EvidenceFact.attribute(FactKind.QUERY_STATS, "queries_planned", planned);
        fact.getAttributes().put("queries_executed", executed);
        fact.getAttributes().put("queries_failed", runner.getFailedCount());
        return fact;
    }

    private Optional<MetricDefinition> lookup(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        return catalog.find(reference);
    }

    private static AnalysisResult unknownMetric(String requestId, String reference) {
        if (reference == null || reference.isBlank()) {
            log.warn("Rejecting analysis {}: no metric given", requestId);
            return AnalysisResult.error(requestId, "Metric reference is required");
        }
        log.warn("Rejecting analysis {}: metric '{}' not in catalog", requestId, reference);
        return AnalysisResult.error(requestId, "Unknown metric: " + reference);
    }

    private static String requestId(String candidate) {
        return candidate != null && !candidate.isBlank() ? candidate : UUID.randomUUID().toString();
    }
}
