package org.carball.deepanalysis.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.deepanalysis.model.analysis.AnalysisResult;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AnalysisDigestTest {

    @Test
    void shouldSummarizeSuccessfulResult() {
        // Given
        AnalysisResult result = ReportFixtures.revenueResult(2);

        // When
        AnalysisDigest digest = AnalysisDigest.from(result);

        // Then
        assertThat(digest.getMetric()).isEqualTo("gross_revenue");
        assertThat(digest.getTimeframe()).isEqualTo("2025-03");
        assertThat(digest.getComparisonTimeframe()).isEqualTo("2025-02");
        assertThat(digest.getNarrative()).isEqualTo(ReportFixtures.NARRATIVE);
        assertThat(digest.getWhenStarted()).isEqualTo("2025-03");
        assertThat(digest.getWhereSignals())
                .containsExactly("Customer Name = Customer 1 (delta -1.00)", "Customer Name = Customer 2 (delta -2.00)");
        assertThat(digest.getWhenSignals()).containsExactly("Fiscal Year-Month = 2025-03 (delta -100.00)");
        assertThat(digest.getKeyHighlights()).containsExactly(
                ReportFixtures.NARRATIVE,
                "Driver: Customer Name = Customer 1 (delta -1.00)",
                "Driver: Customer Name = Customer 2 (delta -2.00)",
                "Change point: Customer Name = Customer 1 (delta -1.00)",
                "Change point: Customer Name = Customer 2 (delta -2.00)",
                "Issue started around 2025-03");
    }

    @Test
    void shouldLimitListSizes() {
        // Given
        AnalysisResult result = ReportFixtures.revenueResult(9);

        // When
        AnalysisDigest digest = AnalysisDigest.from(result);

        // Then
        assertThat(digest.getDimensionFocus()).hasSize(AnalysisDigest.MAX_DIMENSIONS);
        assertThat(digest.getTopChangePoints()).hasSize(AnalysisDigest.MAX_CHANGE_POINTS);
        assertThat(digest.getWhereSignals()).hasSize(AnalysisDigest.MAX_SIGNALS);
        assertThat(digest.getKeyHighlights()).hasSize(AnalysisDigest.MAX_HIGHLIGHTS);
    }

    @Test
    void shouldIncludePercentGrowthInDriver() {
        // Given
        ChangePoint cp = ChangePoint.builder()
                .dimension("Product Name")
                .key("Widget")
                .currentValue(80)
                .previousValue(100)
                .delta(-20)
                .percentGrowth(-20.0)
                .build();

        // Then
        assertThat(AnalysisDigest.driver(cp)).isEqualTo("Product Name = Widget (delta -20.00), -20.00% growth");
    }

    @Test
    void shouldReturnEmptyDigestForFailedResult() throws Exception {
        // When
        AnalysisDigest digest = AnalysisDigest.from(AnalysisResult.error("req-2", "Metric reference is required"));

        // Then
        assertThat(digest.getMetric()).isNull();
        assertThat(digest.getKeyHighlights()).isEmpty();
        JsonNode json = new ObjectMapper().valueToTree(digest);
        assertThat(json.size()).isZero();
    }

    @Test
    void shouldSerializeWithSnakeCaseKeys() {
        // When
        JsonNode json = new ObjectMapper().valueToTree(AnalysisDigest.from(ReportFixtures.revenueResult(1)));

        // Then
        assertThat(json.path("kpi_name").asText()).isEqualTo("gross_revenue");
        assertThat(json.has("scqa_summary")).isTrue();
        assertThat(json.has("top_change_points")).isTrue();
        assertThat(json.has("what_is_highlights")).isTrue();
    }
}
