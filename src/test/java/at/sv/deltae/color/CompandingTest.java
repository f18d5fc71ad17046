package at.sv.deltae.color;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CompandingTest {

    @Test
    void srgb_linearSegment() {
        assertThat(Companding.SRGB.expand(0.04045)).isCloseTo(0.04045 / 12.92, within(1e-12));
        assertThat(Companding.SRGB.compress(0.001)).isCloseTo(0.01292, within(1e-12));
    }

    @Test
    void srgb_powerSegment() {
        assertThat(Companding.SRGB.expand(0.5)).isCloseTo(0.214041, within(1e-6));
        assertThat(Companding.SRGB.compress(0.214041)).isCloseTo(0.5, within(1e-6));
    }

    @Test
    void srgb_endpoints() {
        assertThat(Companding.SRGB.expand(0.0)).isEqualTo(0.0);
        assertThat(Companding.SRGB.expand(1.0)).isCloseTo(1.0, within(1e-12));
        assertThat(Companding.SRGB.compress(1.0)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void linear_isIdentity() {
        assertThat(Companding.LINEAR.expand(0.3)).isEqualTo(0.3);
        assertThat(Companding.LINEAR.compress(0.3)).isEqualTo(0.3);
    }
}
