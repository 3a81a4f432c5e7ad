package org.carball.deepanalysis.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.config.DeepAnalysisConfig;
import org.carball.deepanalysis.gateway.ProbeResult;
import org.carball.deepanalysis.gateway.ProbeRunner;
import org.carball.deepanalysis.model.analysis.GroupComparisonRow;
import org.carball.deepanalysis.model.query.BaselineComparator;
import org.carball.deepanalysis.model.query.ProbeRequest;
import org.carball.deepanalysis.model.query.ProbeResponse;
import org.carball.deepanalysis.model.query.RankSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns probe responses into current-vs-baseline rows for one dimension.
 */
@Slf4j
public class GroupComparisonFetcher {

    static final String TOTAL_KEY = "Total";

    private final ProbeRunner runner;
    private final DeepAnalysisConfig config;

    public GroupComparisonFetcher(ProbeRunner runner, DeepAnalysisConfig config) {
        this.runner = runner;
        this.config = config;
    }

    /**
     * Full group set for {@code dimension}. Asks the gateway for the comparison in one probe
     * and falls back to fetching current and baseline separately when the response carries no
     * baseline column. Empty results count as failures.
     */
    public ProbeResult<List<GroupComparisonRow>> compare(ProbeScope scope, String dimension) {
        return compare(scope, dimension, false);
    }

    /**
     * Like {@link #compare(ProbeScope, String)} for dimensions whose values belong to one window,
     * such as time buckets. When the baseline is the prior window and has to be fetched
     * separately, groups that only exist in the prior window are dropped, so every row is a
     * group of the analysed window.
     */
    public ProbeResult<List<GroupComparisonRow>> compareWithinWindow(ProbeScope scope, String dimension) {
        return compare(scope, dimension, true);
    }

    private ProbeResult<List<GroupComparisonRow>> compare(ProbeScope scope, String dimension,
                                                          boolean currentKeysOnly) {
        ProbeResult<ProbeResponse> combined = runner.run(comparisonRequest(scope, dimension, null));
        if (combined.isSuccess() && hasBaseline(combined.get(), dimension == null)) {
            return nonEmpty(parseComparison(combined.get(), dimension == null), dimension);
        }
        if (combined.isSuccess()) {
            log.debug("Comparison probe on {} returned no baseline column, fetching baseline separately",
                    label(dimension));
        }
        return compareSeparately(scope, dimension, currentKeysOnly);
    }

    /**
     * Current and baseline fetched as two plain probes and joined on group key client-side.
     * Keys missing on one side count as zero.
     */
    public ProbeResult<List<GroupComparisonRow>> compareSeparately(ProbeScope scope, String dimension) {
        return compareSeparately(scope, dimension, false);
    }

    private ProbeResult<List<GroupComparisonRow>> compareSeparately(ProbeScope scope, String dimension,
                                                                    boolean currentKeysOnly) {
        ProbeRequest currentRequest;
        ProbeRequest baselineRequest;

        if (scope.policy().baseline() == BaselineComparator.BUDGET) {
            currentRequest = plainRequest(scope, dimension, scope.timeframe(),
                    withVersion(scope.filters(), config.getActualVersion()));
            baselineRequest = plainRequest(scope, dimension, scope.timeframe(),
                    withVersion(scope.filters(), config.getBudgetVersion()));
        } else {
            if (scope.baselineTimeframe() == null) {
                return ProbeResult.failure("no prior window for " + scope.timeframe());
            }
            if (scope.baselineTimeframe().equalsIgnoreCase(scope.timeframe())) {
                return ProbeResult.failure("prior window of " + scope.timeframe() + " cannot be probed separately");
            }
            currentRequest = plainRequest(scope, dimension, scope.timeframe(), scope.filters());
            baselineRequest = plainRequest(scope, dimension, scope.baselineTimeframe(), scope.filters());
        }

        ProbeResult<ProbeResponse> current = runner.run(currentRequest);
        if (current.isFailure()) {
            return ProbeResult.failure(current.failureReason());
        }
        ProbeResult<ProbeResponse> baseline = runner.run(baselineRequest);
        if (baseline.isFailure()) {
            return ProbeResult.failure(baseline.failureReason());
        }

        boolean scalar = dimension == null;
        Map<String, Double> currentValues = parseValues(current.get(), scalar);
        Map<String, Double> baselineValues = parseValues(baseline.get(), scalar);

        Set<String> keys = new LinkedHashSet<>(currentValues.keySet());
        if (currentKeysOnly && scope.policy().baseline() == BaselineComparator.PREVIOUS) {
            long dropped = baselineValues.keySet().stream().filter(k -> !currentValues.containsKey(k)).count();
            if (dropped > 0) {
                log.debug("Ignoring {} {} groups only present in prior window {}",
                        dropped, label(dimension), scope.baselineTimeframe());
            }
        } else {
            keys.addAll(baselineValues.keySet());
        }

        List<GroupComparisonRow> rows = new ArrayList<>();
        for (String key : keys) {
            rows.add(GroupComparisonRow.of(key,
                    currentValues.getOrDefault(key, 0.0),
                    baselineValues.getOrDefault(key, 0.0)));
        }
        return nonEmpty(rows, dimension);
    }

    /**
     * Groups ranked by signed delta against the baseline, ranked by the gateway.
     */
    public ProbeResult<List<GroupComparisonRow>> ranked(ProbeScope scope, String dimension, RankSpec rank) {
        return runner.run(comparisonRequest(scope, dimension, rank))
                .flatMap(response -> nonEmpty(parseComparison(response, false), dimension));
    }

    /**
     * Metric total for the whole window against its baseline.
     */
    public ProbeResult<GroupComparisonRow> overall(ProbeScope scope) {
        return compare(scope, null).map(rows -> rows.get(0));
    }

    public boolean supportsRanking() {
        return runner.supportsRanking();
    }

    private ProbeRequest comparisonRequest(ProbeScope scope, String dimension, RankSpec rank) {
        return ProbeRequest.builder()
                .metricId(scope.metric().id())
                .measure(scope.measure())
                .dimension(dimension)
                .timeWindow(scope.timeframe())
                .filters(scope.filters())
                .comparator(scope.policy().baseline())
                .rank(rank)
                .build();
    }

    private ProbeRequest plainRequest(ProbeScope scope, String dimension, String window, Map<String, Object> filters) {
        return ProbeRequest.builder()
                .metricId(scope.metric().id())
                .measure(scope.measure())
                .dimension(dimension)
                .timeWindow(window)
                .filters(filters)
                .build();
    }

    private Map<String, Object> withVersion(Map<String, Object> filters, String version) {
        Map<String, Object> copy = new LinkedHashMap<>(filters);
        copy.put(config.getVersionDimension(), version);
        return copy;
    }

    private boolean hasBaseline(ProbeResponse response, boolean scalar) {
        return new Columns(response, scalar).baseline >= 0;
    }

    private List<GroupComparisonRow> parseComparison(ProbeResponse response, boolean scalar) {
        Columns cols = new Columns(response, scalar);
        List<GroupComparisonRow> rows = new ArrayList<>();
        if (cols.current < 0) {
            return rows;
        }
        for (List<Object> row : response.rows()) {
            try {
                String key = cols.key(row);
                double current = toDouble(cell(row, cols.current));
                double baseline = cols.baseline >= 0 ? toDouble(cell(row, cols.baseline)) : 0.0;
                Object rawDelta = cols.delta >= 0 ? cell(row, cols.delta) : null;
                double delta = rawDelta != null ? toDouble(rawDelta) : current - baseline;
                rows.add(GroupComparisonRow.withDelta(key, current, baseline, delta));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                log.debug("Dropping unparseable row {}: {}", row, e.getMessage());
            }
        }
        return rows;
    }

    private Map<String, Double> parseValues(ProbeResponse response, boolean scalar) {
        Columns cols = new Columns(response, scalar);
        Map<String, Double> values = new LinkedHashMap<>();
        if (cols.current < 0) {
            return values;
        }
        for (List<Object> row : response.rows()) {
            try {
                values.put(cols.key(row), toDouble(cell(row, cols.current)));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                log.debug("Dropping unparseable row {}: {}", row, e.getMessage());
            }
        }
        return values;
    }

    private ProbeResult<List<GroupComparisonRow>> nonEmpty(List<GroupComparisonRow> rows, String dimension) {
        if (rows.isEmpty()) {
            return ProbeResult.failure("no rows for " + label(dimension));
        }
        return ProbeResult.success(rows);
    }

    private static Object cell(List<Object> row, int index) {
        if (index >= row.size()) {
            throw new IndexOutOfBoundsException("row has " + row.size() + " cells, needed " + (index + 1));
        }
        return row.get(index);
    }

    /**
     * Missing values count as zero; anything else that is not a finite number is rejected.
     */
    static double toDouble(Object raw) {
        if (raw == null) {
            return 0.0;
        }
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof CharSequence text) {
            value = Double.parseDouble(text.toString().trim());
        } else {
            throw new NumberFormatException("not numeric: " + raw);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("not finite: " + raw);
        }
        return value;
    }

    private static String label(String dimension) {
        return dimension == null ? "<total>" : dimension;
    }

    /**
     * Column positions, matched by name first and by position otherwise. Scalar responses may
     * omit the group key column.
     */
    private static final class Columns {
        final int key;
        final int current;
        final int baseline;
        final int delta;

        Columns(ProbeResponse response, boolean scalar) {
            List<String> names = response.columns();
            int keyIdx = names.indexOf(ProbeResponse.GROUP_KEY);
            if (keyIdx < 0 && !scalar && !names.isEmpty()) {
                keyIdx = 0;
            }
            int firstValue = keyIdx == 0 ? 1 : 0;
            this.key = keyIdx;
            this.current = response.indexOf(firstValue, ProbeResponse.CURRENT_VALUE, "value");
            this.baseline = current < 0 ? -1
                    : response.indexOf(current + 1, ProbeResponse.BASELINE_VALUE, "previous_value", "budget_value");
            this.delta = baseline < 0 ? -1
                    : response.indexOf(baseline + 1, ProbeResponse.DELTA, "delta_prev", "delta");
        }

        String key(List<Object> row) {
            if (key < 0) {
                return TOTAL_KEY;
            }
            return String.valueOf(cell(row, key));
        }
    }
}
