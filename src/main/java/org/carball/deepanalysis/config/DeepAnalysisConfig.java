package org.carball.deepanalysis.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class DeepAnalysisConfig {

    // Planning
    @Builder.Default
    private int maxDimensions = 5;

    @Builder.Default
    private int defaultTargetCount = 5;

    @Builder.Default
    private List<String> bannedDimensionTerms = List.of(
            "flag", "hierarchy", "id", "transaction date", "version",
            "fiscal ytd", "fiscal qtd", "fiscal mtd");

    @Builder.Default
    private List<String> preferredDimensions = List.of(
            "Profit Center Name", "Customer Type Name", "Customer Name", "Product Name");

    @Builder.Default
    private List<String> preferredVectors = List.of("customer", "product", "profit_center");

    // Drilling
    @Builder.Default
    private int rankSize = 3;

    @Builder.Default
    private String timeBucketDimension = "Fiscal Year-Month";

    // Budget comparisons split the same window on this dimension
    @Builder.Default
    private String versionDimension = "Version";

    @Builder.Default
    private String actualVersion = "Actual";

    @Builder.Default
    private String budgetVersion = "Budget";

    // Execution
    @Builder.Default
    private int probeParallelism = 1;

    // null means no overall deadline
    private Duration probeDeadline;

    // Only consulted for metrics that declare no measure
    private String defaultMeasure;

    /**
     * Creates the default configuration.
     */
    public static DeepAnalysisConfig defaults() {
        return DeepAnalysisConfig.builder().build();
    }

    /**
     * Validates the configuration and logs warnings for values that will be clamped or ignored.
     */
    public void validate() {
        if (maxDimensions <= 0) {
            log.warn("Max dimensions ({}) should be positive; plans will hold a single dimension", maxDimensions);
        }

        if (defaultTargetCount > maxDimensions) {
            log.warn("Default target count ({}) exceeds max dimensions ({}) and will be clamped",
                    defaultTargetCount, maxDimensions);
        }

        if (rankSize <= 0) {
            log.warn("Rank size ({}) should be positive", rankSize);
        }

        if (probeParallelism <= 0) {
            log.warn("Probe parallelism ({}) should be positive; vectors will be drilled sequentially",
                    probeParallelism);
        }

        if (probeDeadline != null && (probeDeadline.isNegative() || probeDeadline.isZero())) {
            log.warn("Probe deadline ({}) is not positive; every probe will be skipped", probeDeadline);
        }

        if (timeBucketDimension == null || timeBucketDimension.isBlank()) {
            log.warn("No time bucket dimension configured; temporal drill will only use metric declarations");
        }

        log.debug("Using analysis config - MaxDims: {}, Rank: {}, Parallelism: {}, Deadline: {}",
                maxDimensions, rankSize, probeParallelism, probeDeadline);
    }

    /**
     * Clamps a requested dimension count to [1, maxDimensions].
     */
    public int boundTargetCount(Integer requested) {
        int upper = Math.max(1, maxDimensions);
        int count = requested != null && requested > 0 ? requested : defaultTargetCount;
        return Math.max(1, Math.min(count, upper));
    }

    public String getConfigurationSummary() {
        return String.format("Max dims: %d | Rank size: %d | Time bucket: %s | Parallelism: %d | Deadline: %s",
                maxDimensions, rankSize, timeBucketDimension, probeParallelism,
                probeDeadline != null ? probeDeadline : "none");
    }
}
