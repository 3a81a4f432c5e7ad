package org.carball.deepanalysis.model.analysis;

import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.query.BaselineComparator;

/**
 * Resolved breach rule for one analysis run.
 *
 * @param declared false when no band matched and defaults were applied
 */
public record ThresholdPolicy(
        ComparatorKind comparator,
        boolean inverseLogic,
        double yellowThreshold,
        Double greenThreshold,
        Double redThreshold,
        boolean declared
) {

    public static ThresholdPolicy defaultsFor(ComparatorKind comparator) {
        return new ThresholdPolicy(comparator, false, 0.0, null, null, false);
    }

    public BaselineComparator baseline() {
        return comparator == ComparatorKind.BUDGET ? BaselineComparator.BUDGET : BaselineComparator.PREVIOUS;
    }

    /**
     * Inverse logic treats a rise above the threshold as adverse, otherwise a fall below it is.
     */
    public boolean isBreach(double ratio) {
        return inverseLogic ? ratio > yellowThreshold : ratio < yellowThreshold;
    }
}
