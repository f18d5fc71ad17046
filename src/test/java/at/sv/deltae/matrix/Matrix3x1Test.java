package at.sv.deltae.matrix;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Matrix3x1Test {

    @Test
    void get_byIndex() {
        Matrix3x1 vector = Matrix3x1.of(0.1, 0.2, 0.3);

        assertThat(vector.get(0)).isEqualTo(0.1);
        assertThat(vector.get(1)).isEqualTo(0.2);
        assertThat(vector.get(2)).isEqualTo(0.3);
    }

    @Test
    void get_outOfRange_throws() {
        Matrix3x1 vector = Matrix3x1.of(1, 2, 3);

        assertThatThrownBy(() -> vector.get(3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> vector.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void pow_negativeBaseFractionalExponent_isNaN() {
        Matrix3x1 result = Matrix3x1.of(-8, 4, 9).pow(0.5);

        assertThat(result.x()).isNaN();
        assertThat(result.y()).isEqualTo(2);
        assertThat(result.z()).isEqualTo(3);
    }

    @Test
    void hasZeroComponent() {
        assertThat(Matrix3x1.of(1, 0, 1).hasZeroComponent()).isTrue();
        assertThat(Matrix3x1.of(1, 1, 1).hasZeroComponent()).isFalse();
    }
}
