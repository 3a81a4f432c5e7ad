package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ThresholdPolicy;
import org.carball.deepanalysis.model.metric.ComparatorKind;
import org.carball.deepanalysis.model.metric.MetricDefinition;
import org.carball.deepanalysis.model.metric.ThresholdBand;
import org.carball.deepanalysis.model.query.BaselineComparator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdPolicyResolverTest {

    private final ThresholdPolicyResolver resolver = new ThresholdPolicyResolver();

    @Test
    void shouldDeriveComparatorFromWindow() {
        assertThat(resolver.comparatorFor("current_quarter")).isEqualTo(ComparatorKind.QOQ);
        assertThat(resolver.comparatorFor("this_year")).isEqualTo(ComparatorKind.YOY);
        assertThat(resolver.comparatorFor("current_month")).isEqualTo(ComparatorKind.MOM);
        assertThat(resolver.comparatorFor(null)).isEqualTo(ComparatorKind.MOM);
    }

    @Test
    void shouldUseBandMatchingDerivedComparator() {
        // Given
        MetricDefinition metric = metric(
                band(ComparatorKind.MOM, -0.05, false),
                band(ComparatorKind.QOQ, -0.1, false));

        // When
        ThresholdPolicy policy = resolver.resolve(metric, "current_quarter");

        // Then
        assertThat(policy.comparator()).isEqualTo(ComparatorKind.QOQ);
        assertThat(policy.yellowThreshold()).isEqualTo(-0.1);
        assertThat(policy.declared()).isTrue();
        assertThat(policy.baseline()).isEqualTo(BaselineComparator.PREVIOUS);
    }

    @Test
    void shouldPreferBudgetBandOverWindow() {
        // Given
        MetricDefinition metric = metric(
                band(ComparatorKind.MOM, -0.05, false),
                band(ComparatorKind.BUDGET, 0.0, true));

        // When
        ThresholdPolicy policy = resolver.resolve(metric, "current_month");

        // Then
        assertThat(policy.comparator()).isEqualTo(ComparatorKind.BUDGET);
        assertThat(policy.inverseLogic()).isTrue();
        assertThat(policy.baseline()).isEqualTo(BaselineComparator.BUDGET);
    }

    @Test
    void shouldFallBackToDefaultsWhenNoBandMatches() {
        // Given
        MetricDefinition metric = metric(band(ComparatorKind.YOY, -0.2, true));

        // When
        ThresholdPolicy policy = resolver.resolve(metric, "current_month");

        // Then
        assertThat(policy.comparator()).isEqualTo(ComparatorKind.MOM);
        assertThat(policy.yellowThreshold()).isZero();
        assertThat(policy.inverseLogic()).isFalse();
        assertThat(policy.declared()).isFalse();
    }

    @Test
    void shouldApplyRequestOverride() {
        // Given
        MetricDefinition metric = metric(band(ComparatorKind.MOM, -0.05, false));
        ThresholdBand override = ThresholdBand.builder().yellowThreshold(0.1).inverseLogic(true).build();

        // When
        ThresholdPolicy policy = resolver.resolve(metric, "current_month", override);

        // Then
        assertThat(policy.comparator()).isEqualTo(ComparatorKind.MOM);
        assertThat(policy.yellowThreshold()).isEqualTo(0.1);
        assertThat(policy.inverseLogic()).isTrue();
    }

    @Test
    void shouldKeepDeclaredInverseLogicWhenOverrideOnlyMovesThreshold() {
        // Given
        MetricDefinition expense = metric(band(ComparatorKind.BUDGET, 0.0, true));
        ThresholdBand override = ThresholdBand.builder().yellowThreshold(0.05).build();

        // When
        ThresholdPolicy policy = resolver.resolve(expense, "current_month", override);

        // Then - overspend still breaches, underspend does not
        assertThat(policy.comparator()).isEqualTo(ComparatorKind.BUDGET);
        assertThat(policy.yellowThreshold()).isEqualTo(0.05);
        assertThat(policy.inverseLogic()).isTrue();
        assertThat(policy.isBreach(0.2)).isTrue();
        assertThat(policy.isBreach(-0.3)).isFalse();
    }

    @Test
    void shouldLetOverrideTurnOffInverseLogic() {
        // Given
        MetricDefinition expense = metric(band(ComparatorKind.BUDGET, 0.0, true));
        ThresholdBand override = ThresholdBand.builder().inverseLogic(false).build();

        // When
        ThresholdPolicy policy = resolver.resolve(expense, "current_month", override);

        // Then
        assertThat(policy.inverseLogic()).isFalse();
        assertThat(policy.yellowThreshold()).isZero();
    }

    @Test
    void shouldClassifyBreachByDirection() {
        ThresholdPolicy normal = new ThresholdPolicy(ComparatorKind.MOM, false, 0.0, null, null, true);
        ThresholdPolicy inverse = new ThresholdPolicy(ComparatorKind.BUDGET, true, 0.0, null, null, true);

        assertThat(normal.isBreach(-0.2)).isTrue();
        assertThat(normal.isBreach(0.0)).isFalse();
        assertThat(inverse.isBreach(0.2)).isTrue();
        assertThat(inverse.isBreach(-0.2)).isFalse();
    }

    private static MetricDefinition metric(ThresholdBand... bands) {
        return MetricDefinition.builder().id("revenue").thresholds(List.of(bands)).build();
    }

    private static ThresholdBand band(ComparatorKind comparator, double yellow, boolean inverse) {
        return ThresholdBand.builder().comparator(comparator).yellowThreshold(yellow).inverseLogic(inverse).build();
    }
}
