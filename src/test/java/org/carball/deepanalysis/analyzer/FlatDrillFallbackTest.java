package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.gateway.FakeMetricGateway;
import org.carball.deepanalysis.gateway.ProbeRunner;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.metric.MetricDefinition;
import org.carball.deepanalysis.model.query.ProbeRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlatDrillFallbackTest {

    private static final MetricDefinition REVENUE = MetricDefinition.builder().id("revenue").build();

    @Test
    void shouldUseRankedProbesWhenSupported() {
        // Given
        FakeMetricGateway gateway = regions(new FakeMetricGateway(Scopes.WINDOW));

        // When
        DrillOutcome outcome = fallback(gateway).drill(List.of("Region"), Scopes.previous(REVENUE), 5);

        // Then
        assertThat(outcome.getIsFacts()).extracting(EvidenceFact::getKey).containsExactly("North", "East", "South");
        assertThat(outcome.getIsNotFacts()).extracting(EvidenceFact::getKey).containsExactly("West", "Central", "South");
        assertThat(outcome.getChangePoints()).extracting(ChangePoint::getKey).containsExactly("North", "East", "South");
        assertThat(gateway.getRequests()).filteredOn(ProbeRequest::isRanked).hasSize(2);
        assertThat(outcome.getExtentIs()).hasSize(1);
    }

    @Test
    void shouldRankClientSideWhenRankingUnsupported() {
        // Given
        FakeMetricGateway gateway = regions(new FakeMetricGateway(Scopes.WINDOW).withoutRanking());

        // When
        DrillOutcome outcome = fallback(gateway).drill(List.of("Region"), Scopes.previous(REVENUE), 5);

        // Then
        assertThat(outcome.getIsFacts()).extracting(EvidenceFact::getKey).containsExactly("North", "West", "East");
        assertThat(outcome.getIsNotFacts()).extracting(EvidenceFact::getKey).containsExactly("South", "Central", "East");
        assertThat(outcome.getChangePoints()).hasSize(3);
        assertThat(gateway.getRequests()).noneMatch(ProbeRequest::isRanked);
    }

    @Test
    void shouldLimitToTargetCountAndSkipFailedDimensions() {
        // Given
        FakeMetricGateway gateway = regions(new FakeMetricGateway(Scopes.WINDOW)).failing("Channel");

        // When
        DrillOutcome outcome = fallback(gateway)
                .drill(List.of("Channel", "Region", "Product Name"), Scopes.previous(REVENUE), 2);

        // Then
        assertThat(outcome.getIsFacts()).extracting(EvidenceFact::getDimension).containsOnly("Region");
        assertThat(gateway.requestsFor("Product Name")).isEmpty();
    }

    @Test
    void shouldHonourConfiguredRankSize() {
        // Given
        FakeMetricGateway gateway = regions(new FakeMetricGateway(Scopes.WINDOW));
        DeepAnalysisConfig config = DeepAnalysisConfig.builder().rankSize(1).build();

        // When
        DrillOutcome outcome = new FlatDrillFallback(
                new GroupComparisonFetcher(new ProbeRunner(gateway, null), config), config)
                .drill(List.of("Region"), Scopes.previous(REVENUE), 5);

        // Then
        assertThat(outcome.getIsFacts()).extracting(EvidenceFact::getKey).containsExactly("North");
        assertThat(outcome.getIsNotFacts()).extracting(EvidenceFact::getKey).containsExactly("West");
    }

    private static FakeMetricGateway regions(FakeMetricGateway gateway) {
        return gateway
                .with("Region", "West", 70, 100)
                .with("Region", "East", 120, 100)
                .with("Region", "North", 150, 100)
                .with("Region", "South", 105, 100)
                .with("Region", "Central", 90, 100);
    }

    private static FlatDrillFallback fallback(FakeMetricGateway gateway) {
        DeepAnalysisConfig config = DeepAnalysisConfig.defaults();
        return new FlatDrillFallback(new GroupComparisonFetcher(new ProbeRunner(gateway, null), config), config);
    }
}
