package org.carball.deepanalysis.model.analysis;

import org.carball.deepanalysis.analyzer.VarianceMath;

/**
 * Current against baseline value for one group of a probed dimension.
 */
public record GroupComparisonRow(
        String groupKey,
        double currentValue,
        double baselineValue,
        double delta,
        double ratio
) {

    public static GroupComparisonRow of(String groupKey, double current, double baseline) {
        return withDelta(groupKey, current, baseline, current - baseline);
    }

    /**
     * Uses a delta reported by the backend instead of recomputing it. The ratio is always derived
     * from current and baseline.
     */
    public static GroupComparisonRow withDelta(String groupKey, double current, double baseline, double delta) {
        return new GroupComparisonRow(groupKey, current, baseline, delta, VarianceMath.ratio(current, baseline));
    }

    public double absoluteDelta() {
        return Math.abs(delta);
    }
}
