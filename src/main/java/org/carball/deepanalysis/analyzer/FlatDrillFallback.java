package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.gateway.ProbeResult;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.ClassifiedGroup;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;
import org.carball.deepanalysis.model.query.RankSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Top/bottom movers per plan dimension, used when no hierarchy produced a change point.
 */
@Slf4j
public class FlatDrillFallback {

    private final GroupComparisonFetcher fetcher;
    private final DeepAnalysisConfig config;

    public FlatDrillFallback(GroupComparisonFetcher fetcher, DeepAnalysisConfig config) {
        this.fetcher = fetcher;
        this.config = config;
    }

    public DrillOutcome drill(List<String> dimensions, ProbeScope scope, int targetCount) {
        List<String> bounded = dimensions.size() > targetCount ? dimensions.subList(0, targetCount) : dimensions;
        log.info("Flat drill over {} dimensions for {}", bounded.size(), scope.metric().id());

        DrillOutcome outcome = new DrillOutcome();
        for (String dimension : bounded) {
            drillDimension(dimension, scope, outcome);
        }
        return outcome;
    }

    void drillDimension(String dimension, ProbeScope scope, DrillOutcome outcome) {
        int n = config.getRankSize();
        ProbeResult<List<GroupComparisonRow>> full = null;

        ProbeResult<List<GroupComparisonRow>> top = fetcher.supportsRanking()
                ? fetcher.ranked(scope, dimension, RankSpec.top(n))
                : ProbeResult.failure("ranking not supported");
        ProbeResult<List<GroupComparisonRow>> bottom = fetcher.supportsRanking()
                ? fetcher.ranked(scope, dimension, RankSpec.bottom(n))
                : ProbeResult.failure("ranking not supported");

        if (top.isSuccess()) {
            addMovers(dimension, top.get(), scope, outcome.getIsFacts(), outcome);
        }
        if (bottom.isSuccess()) {
            addMovers(dimension, bottom.get(), scope, outcome.getIsNotFacts(), null);
        }

        if (top.isFailure() || bottom.isFailure()) {
            log.debug("Ranked probes on {} incomplete (top: {}, bottom: {}), ranking client-side",
                    dimension, reason(top), reason(bottom));
            full = fetcher.compare(scope, dimension);
            if (full.isFailure()) {
                log.debug("Skipping dimension {}: {}", dimension, full.failureReason());
                return;
            }
            List<GroupComparisonRow> byMagnitude = new ArrayList<>(full.get());
            byMagnitude.sort(Comparator.comparingDouble(GroupComparisonRow::absoluteDelta).reversed());
            if (top.isFailure()) {
                addMovers(dimension, head(byMagnitude, n), scope, outcome.getIsFacts(), outcome);
            }
            if (bottom.isFailure()) {
                List<GroupComparisonRow> smallest = new ArrayList<>(full.get());
                smallest.sort(Comparator.comparingDouble(GroupComparisonRow::absoluteDelta));
                addMovers(dimension, head(smallest, n), scope, outcome.getIsNotFacts(), null);
            }
        }

        if (full == null) {
            full = fetcher.compare(scope, dimension);
        }
        if (full.isSuccess()) {
            List<ClassifiedGroup> groups = BreachClassifier.classify(full.get(), scope.policy());
            DistributionSummary summary = DistributionSummarizer.summarize(dimension, groups, scope.policy());
            (summary.hasBreaches() ? outcome.getExtentIs() : outcome.getExtentIsNot())
                    .add(EvidenceFact.distribution(summary));
        }
    }

    /**
     * Facts for ranked rows; change points are recorded only when {@code changePoints} is given.
     */
    private static void addMovers(String dimension, List<GroupComparisonRow> rows, ProbeScope scope,
                                  List<EvidenceFact> target, DrillOutcome changePoints) {
        for (GroupComparisonRow row : rows) {
            ClassifiedGroup group = new ClassifiedGroup(row, scope.policy().isBreach(row.ratio()));
            target.add(EvidenceFact.group(dimension, group));
            if (changePoints != null) {
                changePoints.getChangePoints().add(ChangePoint.from(dimension, row));
            }
        }
    }

    private static <T> List<T> head(List<T> list, int n) {
        return list.size() > n ? list.subList(0, n) : list;
    }

    private static String reason(ProbeResult<?> result) {
        return result.isSuccess() ? "ok" : result.failureReason();
    }
}
