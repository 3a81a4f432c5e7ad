package org.carball.deepanalysis.model.query;

/**
 * Asks the gateway for the first {@code n} groups ordered by signed delta against the baseline.
 */
public record RankSpec(RankKind kind, int n, String metric) {

    public static final String DELTA_VS_BASELINE = "delta_vs_baseline";

    public static RankSpec top(int n) {
        return new RankSpec(RankKind.TOP, n, DELTA_VS_BASELINE);
    }

    public static RankSpec bottom(int n) {
        return new RankSpec(RankKind.BOTTOM, n, DELTA_VS_BASELINE);
    }
}
