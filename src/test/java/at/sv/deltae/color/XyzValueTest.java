package at.sv.deltae.color;

import at.sv.deltae.illuminant.Illuminant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XyzValueTest {

    @Test
    void construct_isUnbounded_butFinite() {
        assertThat(XyzValue.of(-0.5, 2.0, 10.0)).isNotNull();
        assertThatThrownBy(() -> XyzValue.of(Double.NaN, 0, 0)).isInstanceOf(OutOfBounds.class);
        assertThatThrownBy(() -> XyzValue.of(0, Double.POSITIVE_INFINITY, 0)).isInstanceOf(OutOfBounds.class);
    }

    @Test
    void defaultIlluminant_isD50() {
        assertThat(XyzValue.of(0.1, 0.2, 0.3).illuminant()).isEqualTo(Illuminant.D50);
        assertThat(XyzValue.parse("0.1, 0.2, 0.3").illuminant()).isEqualTo(Illuminant.D50);
    }

    @Test
    void parse_withIlluminant() {
        assertThat(XyzValue.parse("0.1, 0.2, 0.3", Illuminant.D65))
                .isEqualTo(XyzValue.of(0.1, 0.2, 0.3, Illuminant.D65));
        assertThatThrownBy(() -> XyzValue.parse("0.1 0.2 0.3")).isInstanceOf(BadFormat.class);
    }

    @Test
    void equality_includesIlluminant() {
        assertThat(XyzValue.of(0.1, 0.2, 0.3, Illuminant.D65)).isNotEqualTo(XyzValue.of(0.1, 0.2, 0.3, Illuminant.D50));
    }

    @Test
    void toString_and_format() {
        XyzValue xyz = XyzValue.of(0.25, 1.0, 0.126);

        assertThat(xyz).hasToString("[X:0.25, Y:1, Z:0.126]");
        assertThat(xyz.format(2)).isEqualTo("[X:0.25, Y:1.00, Z:0.13]");
        assertThat(xyz.roundTo(1)).isEqualTo(XyzValue.of(0.3, 1.0, 0.1));
    }

    @Test
    void toLab_yAboveWhite_isOutOfBounds() {
        assertThatThrownBy(() -> XyzValue.of(0.96422, 1.5, 0.82521).toLab()).isInstanceOf(OutOfBounds.class);
    }
}
