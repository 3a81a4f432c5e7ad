package org.carball.deepanalysis.model.metric;

public enum ImprovementDirection {
    HIGHER_IS_BETTER,
    LOWER_IS_BETTER;

    /**
     * Returns true when the given delta moves the metric away from where it should go.
     */
    public boolean isAdverse(double delta) {
        return this == HIGHER_IS_BETTER ? delta < 0 : delta > 0;
    }

    public static ImprovementDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase().replace('-', '_').replace(' ', '_'));
    }
}
