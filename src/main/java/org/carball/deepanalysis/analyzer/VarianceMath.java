package org.carball.deepanalysis.analyzer;

public final class VarianceMath {

    private VarianceMath() {
    }

    /**
     * Relative change of {@code current} against {@code baseline}. A zero baseline yields 0 when
     * current is also zero, otherwise +1 or -1 following the sign of current.
     */
    public static double ratio(double current, double baseline) {
        if (baseline == 0.0) {
            if (current == 0.0) {
                return 0.0;
            }
            return current > 0.0 ? 1.0 : -1.0;
        }
        return (current - baseline) / Math.abs(baseline);
    }

    /**
     * Percent growth for display, or null when the baseline is zero.
     */
    public static Double percentGrowth(double current, double baseline) {
        if (baseline == 0.0) {
            return null;
        }
        return (current - baseline) / Math.abs(baseline) * 100.0;
    }
}
