package at.sv.deltae.color;

import at.sv.deltae.matrix.Matrix3x3;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RgbSystemTest {

    @Test
    void matrices_areInverses() {
        for (RgbSystem system : RgbSystem.values()) {
            Matrix3x3 product = system.getRgbToXyz().multiply(system.getXyzToRgb());
            for (int i = 0; i < 9; i++) {
                assertThat(product.get(i)).as(system + " at " + i).isCloseTo(Matrix3x3.IDENTITY.get(i), within(1e-6));
            }
        }
    }

    @Test
    void white_isIlluminantWhitePoint() {
        for (RgbSystem system : RgbSystem.values()) {
            XyzValue white = system.white();
            XyzValue expected = system.getIlluminant().xyz();

            assertThat(white.x()).as(system.name()).isCloseTo(expected.x(), within(1e-4));
            assertThat(white.y()).as(system.name()).isCloseTo(expected.y(), within(1e-4));
            assertThat(white.z()).as(system.name()).isCloseTo(expected.z(), within(1e-4));
        }
    }

    @Test
    void primaries_areColumns() {
        RgbSystem srgb = RgbSystem.SRGB;

        assertThat(srgb.red().x()).isEqualTo(srgb.getRgbToXyz().get(0, 0));
        assertThat(srgb.green().y()).isEqualTo(srgb.getRgbToXyz().get(1, 1));
        assertThat(srgb.blue().z()).isEqualTo(srgb.getRgbToXyz().get(2, 2));
    }

    @Test
    void onlySrgb_isCompanded() {
        for (RgbSystem system : RgbSystem.values()) {
            Companding expected = system == RgbSystem.SRGB ? Companding.SRGB : Companding.LINEAR;
            assertThat(system.getCompanding()).as(system.name()).isEqualTo(expected);
        }
        assertThat(RgbSystem.DEFAULT).isEqualTo(RgbSystem.SRGB);
    }
}
