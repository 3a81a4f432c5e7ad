package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ClassifiedGroup;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.ThresholdPolicy;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets the variance ratios of one probed level into six fixed bins.
 */
public final class DistributionSummarizer {

    // Bin i holds EDGES[i] <= ratio < EDGES[i + 1]
    private static final double[] EDGES = {
            Double.NEGATIVE_INFINITY, -0.2, -0.1, 0.0, 0.1, 0.2, Double.POSITIVE_INFINITY
    };

    static final List<String> BIN_LABELS = List.of(
            "<-20%", "-20%..-10%", "-10%..0%", "0%..10%", "10%..20%", ">=20%");

    private DistributionSummarizer() {
    }

    public static DistributionSummary summarize(String dimension, List<ClassifiedGroup> groups, ThresholdPolicy policy) {
        Map<String, Integer> histogram = new LinkedHashMap<>();
        BIN_LABELS.forEach(label -> histogram.put(label, 0));

        double[] ratios = new double[groups.size()];
        int breaches = 0;
        for (int i = 0; i < groups.size(); i++) {
            ClassifiedGroup group = groups.get(i);
            ratios[i] = group.ratio();
            histogram.merge(BIN_LABELS.get(binOf(ratios[i])), 1, Integer::sum);
            if (group.breach()) {
                breaches++;
            }
        }
        Arrays.sort(ratios);

        return DistributionSummary.builder()
                .dimension(dimension)
                .comparator(policy.comparator())
                .threshold(policy.yellowThreshold())
                .inverseLogic(policy.inverseLogic())
                .totalKeys(groups.size())
                .breachCount(breaches)
                .withinCount(groups.size() - breaches)
                .histogram(histogram)
                .minRatio(ratios.length > 0 ? ratios[0] : null)
                .medianRatio(ratios.length > 0 ? median(ratios) : null)
                .maxRatio(ratios.length > 0 ? ratios[ratios.length - 1] : null)
                .build();
    }

    static int binOf(double ratio) {
        for (int i = 1; i < EDGES.length; i++) {
            if (ratio < EDGES[i]) {
                return i - 1;
            }
        }
        return EDGES.length - 2;
    }

    private static double median(double[] sorted) {
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
