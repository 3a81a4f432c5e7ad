package org.carball.deepanalysis.gateway;

import org.carball.deepanalysis.model.query.ProbeRequest;
import org.carball.deepanalysis.model.query.ProbeResponse;
import org.carball.deepanalysis.model.query.RankSpec;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeRunnerTest {

    private static final ProbeRequest REGION = ProbeRequest.builder()
            .metricId("revenue")
            .dimension("Region")
            .timeWindow("2025-03")
            .build();

    @Test
    void shouldReturnResponseAndCountExecutedProbe() {
        // Given
        FakeMetricGateway gateway = new FakeMetricGateway("2025-03").with("Region", "West", 80, 100);
        ProbeRunner runner = new ProbeRunner(gateway, null);

        // When
        ProbeResult<ProbeResponse> result = runner.run(REGION);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get().rows()).hasSize(1);
        assertThat(runner.getExecutedCount()).isEqualTo(1);
        assertThat(runner.getFailedCount()).isZero();
        assertThat(runner.remaining()).isNull();
    }

    @Test
    void shouldTurnGatewayExceptionIntoFailure() {
        // Given
        FakeMetricGateway gateway = new FakeMetricGateway("2025-03").failing("Region");
        ProbeRunner runner = new ProbeRunner(gateway, null);

        // When
        ProbeResult<ProbeResponse> result = runner.run(REGION);

        // Then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.failureReason()).contains("backend unavailable");
        assertThat(runner.getFailedCount()).isEqualTo(1);
        assertThat(runner.getExecutedCount()).isZero();
    }

    @Test
    void shouldTurnUnexpectedRuntimeErrorIntoFailure() {
        // Given
        MetricQueryGateway broken = request -> {
            throw new IllegalStateException("connection pool closed");
        };
        ProbeRunner runner = new ProbeRunner(broken, null);

        // When
        ProbeResult<ProbeResponse> result = runner.run(REGION);

        // Then
        assertThat(result.failureReason()).isEqualTo("IllegalStateException: connection pool closed");
        assertThat(runner.getFailedCount()).isEqualTo(1);
    }

    @Test
    void shouldTreatNullResponseAsFailure() {
        // Given
        ProbeRunner runner = new ProbeRunner(request -> null, null);

        // When/Then
        assertThat(runner.run(REGION).isFailure()).isTrue();
        assertThat(runner.getFailedCount()).isEqualTo(1);
    }

    @Test
    void shouldRefuseRankedProbeWhenGatewayCannotRank() {
        // Given
        FakeMetricGateway gateway = new FakeMetricGateway("2025-03").withoutRanking();
        ProbeRunner runner = new ProbeRunner(gateway, null);

        // When
        ProbeResult<ProbeResponse> result = runner.run(REGION.toBuilder().rank(RankSpec.top(3)).build());

        // Then
        assertThat(result.failureReason()).isEqualTo("ranking not supported");
        assertThat(gateway.getRequests()).isEmpty();
        assertThat(runner.getFailedCount()).isZero();
    }

    @Test
    void shouldSkipProbesAfterDeadline() {
        // Given
        MutableClock clock = new MutableClock(Instant.parse("2025-03-31T10:00:00Z"));
        FakeMetricGateway gateway = new FakeMetricGateway("2025-03").with("Region", "West", 80, 100);
        ProbeRunner runner = new ProbeRunner(gateway, Duration.ofSeconds(2), clock);

        // When
        ProbeResult<ProbeResponse> before = runner.run(REGION);
        clock.advance(Duration.ofSeconds(3));
        ProbeResult<ProbeResponse> after = runner.run(REGION);

        // Then
        assertThat(before.isSuccess()).isTrue();
        assertThat(after.failureReason()).isEqualTo("deadline exceeded");
        assertThat(gateway.getRequests()).hasSize(1);
        assertThat(runner.isExpired()).isTrue();
        assertThat(runner.remaining()).isEqualTo(Duration.ZERO);
        assertThat(runner.getFailedCount()).isEqualTo(1);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
