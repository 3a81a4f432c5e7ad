package org.carball.deepanalysis.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the Is/Is-Not table.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvidenceFact {

    public static final String ALL_KEYS = "All";
    public static final String WITHIN_THRESHOLD_NOTE = "All within threshold";

    private FactKind kind;
    private String dimension;
    private String key;
    private String bucket;
    private Double current;
    private Double previous;
    private Double delta;
    private Double ratio;
    private Boolean breach;
    private String note;
    private DistributionSummary distribution;

    @Builder.Default
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public static EvidenceFact group(String dimension, ClassifiedGroup group) {
        GroupComparisonRow row = group.row();
        return EvidenceFact.builder()
                .kind(FactKind.GROUP)
                .dimension(dimension)
                .key(row.groupKey())
                .current(row.currentValue())
                .previous(row.baselineValue())
                .delta(row.delta())
                .ratio(row.ratio())
                .breach(group.breach())
                .build();
    }

    public static EvidenceFact bucket(String dimension, ClassifiedGroup group) {
        GroupComparisonRow row = group.row();
        return EvidenceFact.builder()
                .kind(FactKind.BUCKET)
                .dimension(dimension)
                .bucket(row.groupKey())
                .current(row.currentValue())
                .previous(row.baselineValue())
                .delta(row.delta())
                .ratio(row.ratio())
                .breach(group.breach())
                .build();
    }

    public static EvidenceFact withinThreshold(String dimension) {
        return EvidenceFact.builder()
                .kind(FactKind.WITHIN_THRESHOLD)
                .dimension(dimension)
                .key(ALL_KEYS)
                .note(WITHIN_THRESHOLD_NOTE)
                .build();
    }

    public static EvidenceFact distribution(DistributionSummary summary) {
        return EvidenceFact.builder()
                .kind(FactKind.DISTRIBUTION)
                .dimension(summary.getDimension())
                .distribution(summary)
                .build();
    }

    public static EvidenceFact attribute(FactKind kind, String name, Object value) {
        EvidenceFact fact = EvidenceFact.builder().kind(kind).build();
        fact.getAttributes().put(name, value);
        return fact;
    }

    @JsonIgnore
    public boolean isWithinThreshold() {
        return kind == FactKind.WITHIN_THRESHOLD;
    }

    public boolean hasDelta() {
        return delta != null && !delta.isNaN();
    }

    /**
     * Group key for where facts, bucket label for when facts.
     */
    public String label() {
        return bucket != null ? bucket : key;
    }
}
