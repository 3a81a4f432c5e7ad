package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.gateway.ProbeResult;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.ClassifiedGroup;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks each hierarchy vector from its coarsest level down and stops at the first level
 * with a breaching group.
 * <p>
 * Vectors are independent and may be drilled concurrently; levels inside a vector are
 * always probed in order because a finer level is only needed when the coarser one held.
 */
@Slf4j
public class HierarchicalDrillEngine {

    static final String VECTOR_ATTRIBUTE = "vector";

    private final GroupComparisonFetcher fetcher;
    private final DeepAnalysisConfig config;

    public HierarchicalDrillEngine(GroupComparisonFetcher fetcher, DeepAnalysisConfig config) {
        this.fetcher = fetcher;
        this.config = config;
    }

    public DrillOutcome drill(Map<String, List<String>> hierarchies, ProbeScope scope, Duration remaining) {
        List<String> vectors = orderVectors(hierarchies);
        log.info("Hierarchical drill over {} vectors for {}", vectors.size(), scope.metric().id());

        List<DrillOutcome> perVector = config.getProbeParallelism() > 1 && vectors.size() > 1
                ? drillConcurrently(vectors, hierarchies, scope, remaining)
                : drillSequentially(vectors, hierarchies, scope);

        DrillOutcome merged = new DrillOutcome();
        perVector.forEach(merged::addAll);

        log.info("Hierarchical drill finished: {} change points, stopping levels {}",
                merged.getChangePoints().size(), merged.getStoppingLevels());
        return merged;
    }

    /**
     * Preferred vectors first, then the remaining ones in declaration order.
     */
    List<String> orderVectors(Map<String, List<String>> hierarchies) {
        List<String> ordered = new ArrayList<>();
        for (String preferred : config.getPreferredVectors()) {
            if (hierarchies.containsKey(preferred)) {
                ordered.add(preferred);
            }
        }
        for (String vector : hierarchies.keySet()) {
            if (!ordered.contains(vector)) {
                ordered.add(vector);
            }
        }
        return ordered;
    }

    DrillOutcome drillVector(String vector, List<String> levels, ProbeScope scope) {
        DrillOutcome outcome = new DrillOutcome();

        for (String level : levels) {
            ProbeResult<List<GroupComparisonRow>> rows = fetcher.compare(scope, level);
            if (rows.isFailure()) {
                log.debug("Skipping level {} of vector {}: {}", level, vector, rows.failureReason());
                continue;
            }

            List<ClassifiedGroup> groups = BreachClassifier.classify(rows.get(), scope.policy());
            DistributionSummary summary = DistributionSummarizer.summarize(level, groups, scope.policy());
            EvidenceFact distribution = tagged(EvidenceFact.distribution(summary), vector);

            if (summary.hasBreaches()) {
                outcome.getExtentIs().add(distribution);
                for (ClassifiedGroup group : groups) {
                    EvidenceFact fact = tagged(EvidenceFact.group(level, group), vector);
                    if (group.breach()) {
                        outcome.getIsFacts().add(fact);
                        outcome.getChangePoints().add(ChangePoint.from(level, group.row()));
                    } else {
                        outcome.getIsNotFacts().add(fact);
                    }
                }
                outcome.getStoppingLevels().put(vector, level);
                log.debug("Vector {} stops at level {} with {} breaching groups",
                        vector, level, summary.getBreachCount());
                break;
            }

            outcome.getExtentIsNot().add(distribution);
            outcome.getIsNotFacts().add(tagged(EvidenceFact.withinThreshold(level), vector));
        }
        return outcome;
    }

    private List<DrillOutcome> drillSequentially(List<String> vectors, Map<String, List<String>> hierarchies,
                                                 ProbeScope scope) {
        List<DrillOutcome> outcomes = new ArrayList<>();
        for (String vector : vectors) {
            outcomes.add(drillVector(vector, hierarchies.get(vector), scope));
        }
        return outcomes;
    }

    private List<DrillOutcome> drillConcurrently(List<String> vectors, Map<String, List<String>> hierarchies,
                                                 ProbeScope scope, Duration remaining) {
        int threads = Math.min(config.getProbeParallelism(), vectors.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<String, Future<DrillOutcome>> futures = new LinkedHashMap<>();
            for (String vector : vectors) {
                futures.put(vector, executor.submit(() -> drillVector(vector, hierarchies.get(vector), scope)));
            }

            long deadlineNanos = remaining != null ? System.nanoTime() + remaining.toNanos() : Long.MAX_VALUE;
            List<DrillOutcome> outcomes = new ArrayList<>();
            for (Map.Entry<String, Future<DrillOutcome>> entry : futures.entrySet()) {
                try {
                    if (remaining == null) {
                        outcomes.add(entry.getValue().get());
                    } else {
                        long wait = Math.max(0, deadlineNanos - System.nanoTime());
                        outcomes.add(entry.getValue().get(wait, TimeUnit.NANOSECONDS));
                    }
                } catch (TimeoutException e) {
                    entry.getValue().cancel(true);
                    log.warn("Vector {} did not finish before the request deadline; its evidence is dropped",
                            entry.getKey());
                } catch (ExecutionException e) {
                    log.warn("Vector {} failed: {}", entry.getKey(), e.getCause() != null
                            ? e.getCause().getMessage() : e.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for vector {}", entry.getKey());
                    break;
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static EvidenceFact tagged(EvidenceFact fact, String vector) {
        fact.getAttributes().put(VECTOR_ATTRIBUTE, vector);
        return fact;
    }
}
