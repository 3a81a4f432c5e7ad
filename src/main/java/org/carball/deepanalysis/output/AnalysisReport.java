package org.carball.deepanalysis.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.model.analysis.AnalysisResult;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.DistributionSummary;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.EvidenceTable;
import org.carball.deepanalysis.model.analysis.EvidenceTable.Slot;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class AnalysisReport {

    private static final int MAX_FACTS_PER_CELL = 5;

    private final AnalysisResult result;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public AnalysisReport(AnalysisResult result) {
        this(result, LocalDateTime.now());
    }

    AnalysisReport(AnalysisResult result, LocalDateTime timestamp) {
        this.result = result;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(new ReportData(new ReportMetadata(timestamp), result));
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Deep Analysis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Request:** ").append(result.getRequestId()).append("  \n\n");

        if (!result.isSuccess()) {
            md.append("## Analysis Failed\n\n");
            md.append(result.getErrorMessage()).append("\n");
            return md.toString();
        }

        if (result.getNarrative() != null) {
            md.append("## Summary\n\n");
            md.append(result.getNarrative()).append("\n\n");
        }

        md.append("## Overview\n\n");
        md.append("| Item | Value |\n");
        md.append("|------|-------|\n");
        md.append("| Metric | ").append(result.getPlan().getMetricId()).append(" |\n");
        Map<String, String> mapping = result.getTimeframeMapping();
        if (mapping != null) {
            md.append("| Current Window | ").append(orDash(mapping.get(AnalysisResult.CURRENT))).append(" |\n");
            md.append("| Baseline | ").append(orDash(mapping.get(AnalysisResult.BASELINE))).append(" |\n");
        }
        md.append("| Comparator | ").append(result.getComparator() != null ? result.getComparator().getValue() : "-").append(" |\n");
        md.append("| Dimensions | ").append(String.join(", ", result.getDimensionsSuggested())).append(" |\n");
        md.append("| Change Points | ").append(result.getChangePoints().size()).append(" |\n");
        md.append("| When Started | ").append(orDash(result.getWhenStarted())).append(" |\n\n");

        EvidenceTable table = result.getEvidence();
        if (table != null) {
            md.append("## Is / Is Not\n\n");
            md.append("| | Is | Is Not |\n");
            md.append("|---|---|---|\n");
            row(md, "What", table, Slot.WHAT_IS, Slot.WHAT_IS_NOT);
            row(md, "Where", table, Slot.WHERE_IS, Slot.WHERE_IS_NOT);
            row(md, "When", table, Slot.WHEN_IS, Slot.WHEN_IS_NOT);
            row(md, "Extent", table, Slot.EXTENT_IS, Slot.EXTENT_IS_NOT);
            md.append("\n");
        }

        if (!result.getChangePoints().isEmpty()) {
            md.append("## Change Points\n\n");
            md.append("| Dimension | Key | Current | Previous | Delta | Growth |\n");
            md.append("|-----------|-----|---------|----------|-------|--------|\n");
            for (ChangePoint cp : result.getChangePoints()) {
                md.append("| ").append(cp.getDimension())
                        .append(" | ").append(cp.getKey())
                        .append(" | ").append(format(cp.getCurrentValue()))
                        .append(" | ").append(format(cp.getPreviousValue()))
                        .append(" | ").append(format(cp.getDelta()))
                        .append(" | ").append(cp.getPercentGrowth() != null ? format(cp.getPercentGrowth()) + "%" : "-")
                        .append(" |\n");
            }
            md.append("\n");
        }

        if (result.getStoppingLevels() != null && !result.getStoppingLevels().isEmpty()) {
            md.append("## Stopping Levels\n\n");
            result.getStoppingLevels().forEach((vector, level) ->
                    md.append("- **").append(vector).append(":** ").append(level).append("\n"));
            md.append("\n");
        }

        md.append("---\n\n");
        md.append("*Generated by Deep Analysis Engine*\n");
        return md.toString();
    }

    private static void row(StringBuilder md, String label, EvidenceTable table, Slot is, Slot isNot) {
        md.append("| **").append(label).append("** | ")
                .append(cell(table.get(is))).append(" | ")
                .append(cell(table.get(isNot))).append(" |\n");
    }

    private static String cell(List<EvidenceFact> facts) {
        if (facts.isEmpty()) {
            return "-";
        }
        String shown = facts.stream()
                .limit(MAX_FACTS_PER_CELL)
                .map(AnalysisReport::describe)
                .collect(Collectors.joining("<br>"));
        int hidden = facts.size() - MAX_FACTS_PER_CELL;
        return hidden > 0 ? shown + "<br>(+" + hidden + " more)" : shown;
    }

    static String describe(EvidenceFact fact) {
        switch (fact.getKind()) {
            case GROUP:
            case BUCKET:
            case LARGEST_CHANGE:
            case MOST_STABLE:
                String subject = fact.getDimension() != null
                        ? fact.getDimension() + " = " + fact.label()
                        : String.valueOf(fact.label());
                String text = fact.hasDelta() ? subject + " (delta " + format(fact.getDelta()) + ")" : subject;
                return fact.getNote() != null ? text + " " + fact.getNote() : text;
            case OVERALL_CHANGE:
                return "Overall delta " + format(fact.getDelta())
                        + (fact.getRatio() != null ? " (" + format(fact.getRatio() * 100.0) + "%)" : "");
            case WITHIN_THRESHOLD:
                return fact.getDimension() + ": " + fact.getNote();
            case DISTRIBUTION:
                DistributionSummary d = fact.getDistribution();
                return d.getDimension() + ": " + d.getBreachCount() + " of " + d.getTotalKeys() + " breaching";
            default:
                if (fact.getNote() != null) {
                    return fact.getNote();
                }
                return fact.getAttributes().entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%,.2f", value);
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }

    // Inner classes for JSON structure
    @lombok.Data
    @lombok.AllArgsConstructor
    static class ReportData {
        private ReportMetadata reportMetadata;
        private AnalysisResult analysis;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    static class ReportMetadata {
        private LocalDateTime generated;
    }
}
