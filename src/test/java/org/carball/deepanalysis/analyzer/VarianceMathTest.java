package org.carball.deepanalysis.analyzer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VarianceMathTest {

    @Test
    void shouldComputeRatioAgainstAbsoluteBaseline() {
        assertThat(VarianceMath.ratio(80, 100)).isCloseTo(-0.2, within(1e-9));
        assertThat(VarianceMath.ratio(120, 100)).isCloseTo(0.2, within(1e-9));
        assertThat(VarianceMath.ratio(-50, -100)).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldHandleZeroBaseline() {
        assertThat(VarianceMath.ratio(0, 0)).isEqualTo(0.0);
        assertThat(VarianceMath.ratio(5, 0)).isEqualTo(1.0);
        assertThat(VarianceMath.ratio(-5, 0)).isEqualTo(-1.0);
    }

    @Test
    void shouldReturnNoGrowthForZeroBaseline() {
        assertThat(VarianceMath.percentGrowth(5, 0)).isNull();
        assertThat(VarianceMath.percentGrowth(110, 100)).isCloseTo(10.0, within(1e-9));
    }
}
