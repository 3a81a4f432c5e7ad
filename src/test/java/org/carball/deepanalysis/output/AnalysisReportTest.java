package org.carball.deepanalysis.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.deepanalysis.model.analysis.AnalysisResult;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.FactKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

public class AnalysisReportTest {

    private static final LocalDateTime GENERATED = LocalDateTime.of(2025, 4, 2, 9, 30, 15);

    @Test
    void shouldSerializeResultWithSnakeCaseKeys() throws Exception {
        // Given
        AnalysisReport report = new AnalysisReport(ReportFixtures.revenueResult(2), GENERATED);

        // When
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        // Then
        assertThat(json.path("reportMetadata").path("generated").asText()).isEqualTo("2025-04-02T09:30:15");
        JsonNode analysis = json.path("analysis");
        assertThat(analysis.path("request_id").asText()).isEqualTo("req-1");
        assertThat(analysis.path("status").asText()).isEqualTo("success");
        assertThat(analysis.path("comparator").asText()).isEqualTo("mom");
        assertThat(analysis.path("plan").path("kpi_name").asText()).isEqualTo("gross_revenue");
        assertThat(analysis.path("timeframe_mapping").path("baseline").asText()).isEqualTo("2025-02");
        assertThat(analysis.path("change_points").size()).isEqualTo(2);
        assertThat(analysis.path("change_points").get(0).path("current_value").asDouble()).isEqualTo(99.0);
        assertThat(analysis.path("stopping_levels").path("customer").asText()).isEqualTo("Customer Name");

        JsonNode evidence = analysis.path("kt_is_is_not");
        assertThat(evidence.path("where_is").size()).isEqualTo(2);
        assertThat(evidence.path("where_is").get(0).path("kind").asText()).isEqualTo("group");
        assertThat(evidence.path("extent_is_not").isArray()).isTrue();
        assertThat(analysis.has("error_message")).isFalse();
    }

    @Test
    void shouldRenderMarkdownSections() {
        // Given
        AnalysisReport report = new AnalysisReport(ReportFixtures.revenueResult(2), GENERATED);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown)
                .startsWith("# Deep Analysis Report")
                .contains("**Generated:** 2025-04-02T09:30:15")
                .contains("## Summary")
                .contains(ReportFixtures.NARRATIVE)
                .contains("| Metric | gross_revenue |")
                .contains("| Baseline | 2025-02 |")
                .contains("| Comparator | mom |")
                .contains("| When Started | 2025-03 |")
                .contains("## Is / Is Not")
                .contains("Customer Name = Customer 1 (delta -1.00)")
                .contains("Product Name: All within threshold")
                .contains("Overall delta -100.00 (-10.00%)")
                .contains("## Change Points")
                .contains("| Customer Name | Customer 2 | 98.00 | 100.00 | -2.00 | - |")
                .contains("- **customer:** Customer Name")
                .endsWith("*Generated by Deep Analysis Engine*\n");
    }

    @Test
    void shouldCapFactsPerCell() {
        // Given
        AnalysisReport report = new AnalysisReport(ReportFixtures.revenueResult(8), GENERATED);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown)
                .contains("Customer Name = Customer 5")
                .doesNotContain("Customer Name = Customer 6 (delta")
                .contains("(+3 more)");
    }

    @Test
    void shouldRenderFailure() {
        // Given
        AnalysisReport report = new AnalysisReport(AnalysisResult.error("req-9", "Unknown metric: churn"), GENERATED);

        // When
        String markdown = report.toMarkdown();

        // Then
        assertThat(markdown)
                .contains("## Analysis Failed")
                .contains("Unknown metric: churn")
                .doesNotContain("## Overview");
    }

    @Test
    void shouldDescribeDistributionAndStatsFacts() {
        // Given
        EvidenceFact distribution = EvidenceFact.distribution(DistributionSummary.builder()
                .dimension("Customer Name")
                .totalKeys(12)
                .breachCount(3)
                .build());
        EvidenceFact stats = EvidenceFact.attribute(FactKind.QUERY_STATS, "queries_executed", 7);

        // Then
        assertThat(AnalysisReport.describe(distribution)).isEqualTo("Customer Name: 3 of 12 breaching");
        assertThat(AnalysisReport.describe(stats)).isEqualTo("queries_executed=7");
    }
}
