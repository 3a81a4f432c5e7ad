package org.carball.deepanalysis.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deepanalysis.model.analysis.AnalysisResult;
import org.carball.deepanalysis.model.analysis.ChangePoint;
import org.carball.deepanalysis.model.analysis.EvidenceFact;
import org.carball.deepanalysis.model.analysis.EvidenceTable;
import org.carball.deepanalysis.model.analysis.EvidenceTable.Slot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compact view of an analysis result for the step that turns findings into recommendations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class AnalysisDigest {

    static final int MAX_CHANGE_POINTS = 5;
    static final int MAX_DIMENSIONS = 6;
    static final int MAX_SIGNALS = 5;
    static final int MAX_HIGHLIGHTS = 6;

    @JsonProperty("kpi_name")
    private String metric;

    private String timeframe;

    @JsonProperty("comparison_timeframe")
    private String comparisonTimeframe;

    @JsonProperty("scqa_summary")
    private String narrative;

    @JsonProperty("dimension_focus")
    @Builder.Default
    private List<String> dimensionFocus = new ArrayList<>();

    @JsonProperty("top_change_points")
    @Builder.Default
    private List<ChangePoint> topChangePoints = new ArrayList<>();

    @JsonProperty("what_is_highlights")
    @Builder.Default
    private List<String> whatIsHighlights = new ArrayList<>();

    @JsonProperty("where_signals")
    @Builder.Default
    private List<String> whereSignals = new ArrayList<>();

    @JsonProperty("when_signals")
    @Builder.Default
    private List<String> whenSignals = new ArrayList<>();

    @JsonProperty("when_started")
    private String whenStarted;

    @JsonProperty("key_highlights")
    @Builder.Default
    private List<String> keyHighlights = new ArrayList<>();

    public static AnalysisDigest from(AnalysisResult result) {
        AnalysisDigest digest = new AnalysisDigest();
        if (result == null || !result.isSuccess()) {
            return digest;
        }

        if (result.getPlan() != null) {
            digest.setMetric(result.getPlan().getMetricId());
            digest.setTimeframe(result.getPlan().getTimeframe());
            digest.setDimensionFocus(limit(result.getPlan().getDimensions(), MAX_DIMENSIONS));
        }
        if (result.getTimeframeMapping() != null) {
            digest.setComparisonTimeframe(result.getTimeframeMapping().get(AnalysisResult.BASELINE));
        }
        digest.setNarrative(result.getNarrative());
        digest.setWhenStarted(result.getWhenStarted());
        digest.setTopChangePoints(limit(result.getChangePoints(), MAX_CHANGE_POINTS));

        EvidenceTable table = result.getEvidence();
        if (table != null) {
            digest.setWhatIsHighlights(signals(table.get(Slot.WHAT_IS)));
            digest.setWhereSignals(signals(table.get(Slot.WHERE_IS)));
            digest.setWhenSignals(signals(table.get(Slot.WHEN_IS)));
        }

        List<String> highlights = new ArrayList<>();
        if (digest.getNarrative() != null) {
            highlights.add(digest.getNarrative());
        }
        digest.getWhereSignals().stream().limit(3).forEach(s -> highlights.add("Driver: " + s));
        digest.getTopChangePoints().stream().limit(3).forEach(cp -> highlights.add("Change point: " + driver(cp)));
        if (digest.getWhenStarted() != null) {
            highlights.add("Issue started around " + digest.getWhenStarted());
        }
        digest.setKeyHighlights(limit(highlights, MAX_HIGHLIGHTS));
        return digest;
    }

    private static List<String> signals(List<EvidenceFact> facts) {
        List<String> texts = new ArrayList<>();
        for (EvidenceFact fact : facts) {
            if (texts.size() == MAX_SIGNALS) {
                break;
            }
            String text = AnalysisReport.describe(fact);
            if (text != null && !text.isBlank()) {
                texts.add(text);
            }
        }
        return texts;
    }

    static String driver(ChangePoint cp) {
        String text = String.format(Locale.ROOT, "%s = %s (delta %.2f)", cp.getDimension(), cp.getKey(), cp.getDelta());
        if (cp.getPercentGrowth() != null) {
            text += String.format(Locale.ROOT, ", %.2f%% growth", cp.getPercentGrowth());
        }
        return text;
    }

    private static <T> List<T> limit(List<T> items, int max) {
        if (items == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(items.size() > max ? items.subList(0, max) : items);
    }
}
