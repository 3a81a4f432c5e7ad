package org.carball.deepanalysis.analyzer;

import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.model.analysis.AnalysisPlan;
import org.carball.deepanalysis.model.analysis.AnalysisRequest;
import org.carball.deepanalysis.model.analysis.PlanStep;
import org.carball.deepanalysis.model.metric.MetricDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DimensionPlanBuilderTest {

    private DimensionPlanBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DimensionPlanBuilder(DeepAnalysisConfig.defaults());
    }

    @Test
    void shouldDropBannedLabelsAndMovePreferredToFront() {
        // Given
        MetricDefinition metric = MetricDefinition.builder()
                .id("revenue")
                .dimensions(List.of("Region", "Customer ID", "Product Name", "Posting Flag",
                        "customer name", "Fiscal YTD Bucket", "Version", "Channel"))
                .build();

        // When
        List<String> dimensions = builder.enumerateDimensions(metric);

        // Then
        assertThat(dimensions).containsExactly("customer name", "Product Name", "Region", "Channel");
    }

    @Test
    void shouldSeedFromTopHierarchyLevelsWhenNoDimensionsDeclared() {
        // Given
        Map<String, List<String>> hierarchies = new LinkedHashMap<>();
        hierarchies.put("customer", List.of("Customer Type Name", "Customer Name"));
        hierarchies.put("product", List.of("Product Category", "Product Name"));
        MetricDefinition metric = MetricDefinition.builder().id("revenue").hierarchies(hierarchies).build();

        // When
        List<String> dimensions = builder.enumerateDimensions(metric);

        // Then
        assertThat(dimensions).containsExactly("Customer Type Name", "Product Category");
    }

    @Test
    void shouldTruncateToClampedTargetCount() {
        // Given
        MetricDefinition metric = MetricDefinition.builder()
                .id("revenue")
                .dimensions(List.of("A", "B", "C", "D", "E", "F", "G"))
                .build();

        // When/Then
        assertThat(builder.selectDimensions(metric, 2)).containsExactly("A", "B");
        assertThat(builder.selectDimensions(metric, 0)).hasSize(5);
        assertThat(builder.selectDimensions(metric, 50)).hasSize(5);
        assertThat(builder.selectDimensions(metric, null)).hasSize(5);
    }

    @Test
    void shouldProduceEmptyPlanWhenNothingResolvable() {
        // Given
        MetricDefinition metric = MetricDefinition.builder().id("orders").dimensions(List.of("Order ID")).build();

        // When
        AnalysisPlan plan = builder.plan(metric, AnalysisRequest.builder().metricId("orders").build());

        // Then
        assertThat(plan.getDimensions()).isEmpty();
        assertThat(plan.getSteps()).isEmpty();
    }

    @Test
    void shouldBuildDeterministicPlan() {
        // Given
        MetricDefinition metric = MetricDefinition.builder()
                .id("revenue")
                .dimensions(List.of("Region", "Product Name"))
                .build();
        AnalysisRequest request = AnalysisRequest.builder()
                .metricId("revenue")
                .timeframe("current_quarter")
                .filters(Map.of("Region", "West"))
                .build();

        // When
        AnalysisPlan first = builder.plan(metric, request);
        AnalysisPlan second = builder.plan(metric, request);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.getSteps()).extracting(PlanStep::dimension).containsExactly("Product Name", "Region");
        assertThat(first.getSteps()).allSatisfy(step -> {
            assertThat(step.type()).isEqualTo(PlanStep.GROUP_COMPARE);
            assertThat(step.comparison()).isEqualTo(PlanStep.CURRENT_VS_PREVIOUS);
            assertThat(step.timeframe()).isEqualTo("current_quarter");
            assertThat(step.filters()).containsEntry("Region", "West");
        });
    }

    @Test
    void shouldBackfillOnlyOnce() {
        // Given
        MetricDefinition metric = MetricDefinition.builder()
                .id("revenue")
                .dimensions(List.of("Region", "Channel"))
                .build();
        AnalysisPlan plan = AnalysisPlan.builder().metricId("revenue").timeframe("current_month").build();

        // When
        builder.backfill(plan, metric);
        List<PlanStep> steps = List.copyOf(plan.getSteps());
        builder.backfill(plan, metric);

        // Then
        assertThat(plan.getDimensions()).containsExactly("Region", "Channel");
        assertThat(plan.getSteps()).containsExactlyElementsOf(steps);
    }
}
