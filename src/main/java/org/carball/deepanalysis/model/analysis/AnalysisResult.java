package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.deepanalysis.model.metric.ComparatorKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {

    public static final String CURRENT = "current";
    public static final String BASELINE = "baseline";

    @JsonProperty("request_id")
    private String requestId;

    private AnalysisStatus status;

    @JsonProperty("error_message")
    private String errorMessage;

    private AnalysisPlan plan;

    @JsonProperty("dimensions_suggested")
    @Builder.Default
    private List<String> dimensionsSuggested = new ArrayList<>();

    @JsonProperty("kt_is_is_not")
    private EvidenceTable evidence;

    @JsonProperty("change_points")
    @Builder.Default
    private List<ChangePoint> changePoints = new ArrayList<>();

    @JsonProperty("scqa_summary")
    private String narrative;

    @JsonProperty("timeframe_mapping")
    private Map<String, String> timeframeMapping;

    @JsonProperty("when_started")
    private String whenStarted;

    // hierarchy vector -> level where drilling stopped on a breach
    @JsonProperty("stopping_levels")
    @Builder.Default
    private Map<String, String> stoppingLevels = new LinkedHashMap<>();

    private ComparatorKind comparator;

    @JsonProperty("percent_growth_enabled")
    private boolean percentGrowthEnabled;

    public static AnalysisResult error(String requestId, String message) {
        return AnalysisResult.builder()
                .requestId(requestId)
                .status(AnalysisStatus.ERROR)
                .errorMessage(message)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == AnalysisStatus.SUCCESS;
    }
}
