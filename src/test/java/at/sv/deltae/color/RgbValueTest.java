package at.sv.deltae.color;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RgbValueTest {

    @Test
    void construct_outOfRange_throws() {
        assertThatThrownBy(() -> RgbValue.of(256, 0, 0)).isInstanceOf(OutOfBounds.class);
        assertThatThrownBy(() -> RgbValue.of(0, -1, 0)).isInstanceOf(OutOfBounds.class);
    }

    @Test
    void parse() {
        assertThat(RgbValue.parse("64, 128 ,192")).isEqualTo(RgbValue.of(64, 128, 192));
        assertThatThrownBy(() -> RgbValue.parse("64, 128.5, 192")).isInstanceOf(BadFormat.class);
        assertThatThrownBy(() -> RgbValue.parse("64, 128")).isInstanceOf(BadFormat.class);
        assertThatThrownBy(() -> RgbValue.parse("64, 128, 300")).isInstanceOf(OutOfBounds.class);
    }

    @Test
    void invert() {
        assertThat(RgbValue.of(64, 128, 192).invert()).isEqualTo(RgbValue.of(191, 127, 63));
        assertThat(RgbValue.of(0, 128, 255).invert()).isEqualTo(RgbValue.of(255, 127, 0));
    }

    @Test
    void nominalize() {
        RgbNominalValue nominal = RgbValue.of(64, 128, 255).nominalize();

        assertThat(nominal.r()).isCloseTo(0.25098039, within(1e-8));
        assertThat(nominal.g()).isCloseTo(0.50196078, within(1e-8));
        assertThat(nominal.b()).isEqualTo(1.0);
    }

    @Test
    void denominalize_roundsToNearest() {
        assertThat(new RgbNominalValue(0.25, 0.5, 0.0).denominalize()).isEqualTo(RgbValue.of(64, 128, 0));
        assertThat(RgbValue.of(64, 128, 192).nominalize().denominalize()).isEqualTo(RgbValue.of(64, 128, 192));
    }

    @Test
    void nominal_clamped() {
        assertThat(RgbNominalValue.clamped(-0.2, 1.3, Double.NaN)).isEqualTo(new RgbNominalValue(0.0, 1.0, 0.0));
        assertThatThrownBy(() -> new RgbNominalValue(1.1, 0, 0)).isInstanceOf(OutOfBounds.class);
    }

    @Test
    void toString_format() {
        assertThat(RgbValue.of(64, 128, 192)).hasToString("[R:64, G:128, B:192]");
    }
}
