package org.carball.deepanalysis.gateway;

import lombok.extern.slf4j.Slf4j;
import org.carball.deepanalysis.model.query.ProbeRequest;
import org.carball.deepanalysis.model.query.ProbeResponse;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues probes for one analysis request. Gateway errors become failed results so that
 * drill loops never see exceptions. Safe to share between vector workers.
 */
@Slf4j
public class ProbeRunner {

    private final MetricQueryGateway gateway;
    private final Clock clock;
    private final Instant deadline;
    private final AtomicInteger executed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public ProbeRunner(MetricQueryGateway gateway, Duration budget) {
        this(gateway, budget, Clock.systemUTC());
    }

    ProbeRunner(MetricQueryGateway gateway, Duration budget, Clock clock) {
        this.gateway = gateway;
        this.clock = clock;
        this.deadline = budget != null ? clock.instant().plus(budget) : null;
    }

    public ProbeResult<ProbeResponse> run(ProbeRequest request) {
        if (isExpired()) {
            failed.incrementAndGet();
            log.debug("Skipping probe on {}: request deadline passed", describe(request));
            return ProbeResult.failure("deadline exceeded");
        }
        if (request.isRanked() && !gateway.supportsRanking()) {
            return ProbeResult.failure("ranking not supported");
        }

        try {
            ProbeResponse response = gateway.probe(request);
            if (response == null) {
                failed.incrementAndGet();
                return ProbeResult.failure("gateway returned no response");
            }
            executed.incrementAndGet();
            return ProbeResult.success(response);
        } catch (ProbeException e) {
            failed.incrementAndGet();
            log.debug("Probe on {} failed: {}", describe(request), e.getMessage());
            return ProbeResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("Probe on {} raised an unexpected error", describe(request), e);
            return ProbeResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public boolean supportsRanking() {
        return gateway.supportsRanking();
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left before the deadline, or null when the request has none.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public int getExecutedCount() {
        return executed.get();
    }

    public int getFailedCount() {
        return failed.get();
    }

    private static String describe(ProbeRequest request) {
        String target = request.isScalar() ? "<total>" : request.dimension();
        return request.isRanked() ? target + " (" + request.rank().kind().getValue() + ")" : target;
    }
}
