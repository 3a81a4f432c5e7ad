package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.gateway.ProbeResult;
import org.carball.deepanalysis.model.analysis.ClassifiedGroup;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;
import org.carball.deepanalysis.model.query.RankSpec;

import java.util.List;

/**
 * Compares the metric bucket by bucket along its time dimension. Breaching buckets are
 * reported as "when is" facts, the rest as "when is not".
 */
@Slf4j
public class TemporalDrill {

    private final GroupComparisonFetcher fetcher;
    private final DeepAnalysisConfig config;

    public TemporalDrill(GroupComparisonFetcher fetcher, DeepAnalysisConfig config) {
        this.fetcher = fetcher;
        this.config = config;
    }

    public DrillOutcome drill(ProbeScope scope) {
        String bucketDimension = bucketDimension(scope);
        DrillOutcome outcome = new DrillOutcome();

        ProbeResult<List<GroupComparisonRow>> full = fetcher.compareWithinWindow(scope, bucketDimension);
        if (full.isSuccess()) {
            List<ClassifiedGroup> groups = BreachClassifier.classify(full.get(), scope.policy());
            for (ClassifiedGroup group : groups) {
                EvidenceFact fact = EvidenceFact.bucket(bucketDimension, group);
                (group.breach() ? outcome.getIsFacts() : outcome.getIsNotFacts()).add(fact);
            }
            DistributionSummary summary = DistributionSummarizer.summarize(bucketDimension, groups, scope.policy());
            (summary.hasBreaches() ? outcome.getExtentIs() : outcome.getExtentIsNot())
                    .add(EvidenceFact.distribution(summary));
            log.info("Temporal drill on {}: {} buckets, {} breaching",
                    bucketDimension, summary.getTotalKeys(), summary.getBreachCount());
            return outcome;
        }

        log.debug("Full bucket comparison on {} unavailable ({}), trying ranked buckets",
                bucketDimension, full.failureReason());
        int n = config.getRankSize();
        fetcher.ranked(scope, bucketDimension, RankSpec.top(n))
                .toOptional()
                .ifPresent(rows -> addBuckets(bucketDimension, rows, scope, outcome.getIsFacts()));
        fetcher.ranked(scope, bucketDimension, RankSpec.bottom(n))
                .toOptional()
                .ifPresent(rows -> addBuckets(bucketDimension, rows, scope, outcome.getIsNotFacts()));

        if (outcome.isEmpty()) {
            log.info("Temporal drill on {} produced no evidence", bucketDimension);
        }
        return outcome;
    }

    String bucketDimension(ProbeScope scope) {
        String declared = scope.metric().timeBucketDimension();
        return declared != null && !declared.isBlank() ? declared : config.getTimeBucketDimension();
    }

    private static void addBuckets(String dimension, List<GroupComparisonRow> rows, ProbeScope scope,
                                   List<EvidenceFact> target) {
        for (GroupComparisonRow row : rows) {
            target.add(EvidenceFact.bucket(dimension,
                    new ClassifiedGroup(row, scope.policy().isBreach(row.ratio()))));
        }
    }
}
