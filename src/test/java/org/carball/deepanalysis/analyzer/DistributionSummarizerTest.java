package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.model.analysis.ClassifiedGroup;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DistributionSummarizerTest {

    @Test
    void shouldPlaceRatiosIntoHalfOpenBins() {
        assertThat(DistributionSummarizer.binOf(-0.5)).isZero();
        assertThat(DistributionSummarizer.binOf(-0.2)).isEqualTo(1);
        assertThat(DistributionSummarizer.binOf(-0.05)).isEqualTo(2);
        assertThat(DistributionSummarizer.binOf(0.0)).isEqualTo(3);
        assertThat(DistributionSummarizer.binOf(0.15)).isEqualTo(4);
        assertThat(DistributionSummarizer.binOf(0.2)).isEqualTo(5);
        assertThat(DistributionSummarizer.binOf(7.0)).isEqualTo(5);
    }

    @Test
    void shouldSummarizeLevel() {
        // Given
        List<GroupComparisonRow> rows = List.of(
                GroupComparisonRow.of("West", 80, 100),
                GroupComparisonRow.of("East", 105, 100),
                GroupComparisonRow.of("North", 100, 100),
                GroupComparisonRow.of("South", 130, 100));
        List<ClassifiedGroup> groups = BreachClassifier.classify(rows, Scopes.monthOverMonth());

        // When
        DistributionSummary summary = DistributionSummarizer.summarize("Region", groups, Scopes.monthOverMonth());

        // Then
        assertThat(summary.getTotalKeys()).isEqualTo(4);
        assertThat(summary.getBreachCount()).isEqualTo(1);
        assertThat(summary.getWithinCount()).isEqualTo(3);
        assertThat(summary.getHistogram()).containsKeys(DistributionSummarizer.BIN_LABELS.toArray(new String[0]));
        assertThat(summary.getHistogram().values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(4);
        assertThat(summary.getHistogram()).containsEntry("-20%..-10%", 1).containsEntry(">=20%", 1);
        assertThat(summary.getMinRatio()).isEqualTo(-0.2, within(1e-9));
        assertThat(summary.getMaxRatio()).isEqualTo(0.3, within(1e-9));
        assertThat(summary.getMedianRatio()).isEqualTo(0.025, within(1e-9));
        assertThat(summary.hasBreaches()).isTrue();
    }

    @Test
    void shouldSummarizeEmptyLevel() {
        // When
        DistributionSummary summary = DistributionSummarizer.summarize("Region", List.of(), Scopes.monthOverMonth());

        // Then
        assertThat(summary.getTotalKeys()).isZero();
        assertThat(summary.getMedianRatio()).isNull();
        assertThat(summary.getHistogram()).hasSize(6).allSatisfy((bin, count) -> assertThat(count).isZero());
    }
}
