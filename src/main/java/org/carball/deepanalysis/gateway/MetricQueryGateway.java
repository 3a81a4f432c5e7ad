package org.carball.deepanalysis.gateway;

import org.carball.deepanalysis.model.query.ProbeRequest;
import org.carball.deepanalysis.model.query.ProbeResponse;

/**
 * Executes grouped and ranked aggregate probes against one metric backend.
 * <p>
 * Implementations own query generation and execution. A response for a comparator probe
 * carries {@code [group_key, current_value, baseline_value, delta_vs_baseline]}; a probe
 * without comparator may return only {@code [group_key, current_value]}. Scalar probes
 * ({@code dimension == null}) return a single row.
 */
public interface MetricQueryGateway {

    ProbeResponse probe(ProbeRequest request) throws ProbeException;

    /**
     * Whether {@link ProbeRequest#rank()} is honoured. Callers fall back to full group fetches when not.
     */
    default boolean supportsRanking() {
        return true;
    }
}
