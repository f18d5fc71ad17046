package at.sv.deltae.illuminant;

import at.sv.deltae.color.XyzValue;
import at.sv.deltae.matrix.Matrix3x3;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ChromaticAdaptationTest {

    private static final double EPS = 1e-6;

    private static void assertXyz(XyzValue actual, double x, double y, double z) {
        assertThat(actual.x()).as("X of " + actual).isCloseTo(x, within(EPS));
        assertThat(actual.y()).as("Y of " + actual).isCloseTo(y, within(EPS));
        assertThat(actual.z()).as("Z of " + actual).isCloseTo(z, within(EPS));
    }

    @ParameterizedTest
    @EnumSource(ChromaticAdaptationMethod.class)
    void adapt_whitePoint_mapsToDestinationWhite(ChromaticAdaptationMethod method) {
        XyzValue adapted = Illuminant.D65.xyz().adapt(Illuminant.D50, method);

        assertXyz(adapted, 0.96422, 1.0, 0.82521);
        assertThat(adapted.illuminant()).isEqualTo(Illuminant.D50);
    }

    @Test
    void adapt_bradford_d65ToD50_andBack() {
        XyzValue d65 = XyzValue.of(0.193444, 0.203321, 0.527640, Illuminant.D65);

        XyzValue d50 = d65.adapt(Illuminant.D50);

        assertXyz(d50, 0.180897, 0.198105, 0.398127);
        assertXyz(d50.adapt(Illuminant.D65), d65.x(), d65.y(), d65.z());
    }

    @Test
    void adapt_sameIlluminant_returnsInput() {
        XyzValue xyz = XyzValue.of(0.2, 0.3, 0.4, Illuminant.D50);

        assertThat(xyz.adapt(Illuminant.D50)).isSameAs(xyz);
        assertThat(xyz.adapt(Illuminant.other(0.96422, 1.0, 0.82521))).isSameAs(xyz);
    }

    @Test
    void adapt_zeroComponent_throws() {
        XyzValue xyz = XyzValue.of(0.2, 0.3, 0.4, Illuminant.D50);

        assertThatThrownBy(() -> xyz.adapt(Illuminant.other(0.9, 0.0, 1.0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> XyzValue.of(0.2, 0.3, 0.4, Illuminant.other(0.0, 1.0, 1.0)).adapt(Illuminant.D65))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void adaptationMatrix_xyzScaling_isDiagonal() {
        Matrix3x3 matrix = ChromaticAdaptation.adaptationMatrix(Illuminant.D65, Illuminant.D50,
                ChromaticAdaptationMethod.XYZ_SCALING);

        assertThat(matrix.get(0, 0)).isCloseTo(0.96422 / 0.95047, within(1e-12));
        assertThat(matrix.get(1, 1)).isCloseTo(1.0, within(1e-12));
        assertThat(matrix.get(2, 2)).isCloseTo(0.82521 / 1.08883, within(1e-12));
        assertThat(matrix.get(1, 0)).isEqualTo(0.0);
    }

    @ParameterizedTest
    @EnumSource(ChromaticAdaptationMethod.class)
    void coneResponseMatrices_areInverses(ChromaticAdaptationMethod method) {
        Matrix3x3 product = method.getConeResponseMatrix().multiply(method.getInverseConeResponseMatrix());

        for (int i = 0; i < 9; i++) {
            assertThat(product.get(i)).isCloseTo(Matrix3x3.IDENTITY.get(i), within(1e-6));
        }
    }
}
