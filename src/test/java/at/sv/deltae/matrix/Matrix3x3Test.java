package at.sv.deltae.matrix;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class Matrix3x3Test {

    private static final Matrix3x3 M = new Matrix3x3(
            1, 2, 3,
            4, 5, 6,
            7, 8, 10);

    @Test
    void get_linearIndex_isRowMajor() {
        assertThat(M.get(0)).isEqualTo(1);
        assertThat(M.get(2)).isEqualTo(3);
        assertThat(M.get(3)).isEqualTo(4);
        assertThat(M.get(8)).isEqualTo(10);
    }

    @Test
    void get_columnAndRow() {
        assertThat(M.get(2, 0)).isEqualTo(3);
        assertThat(M.get(0, 2)).isEqualTo(7);
        assertThat(M.get(1, 1)).isEqualTo(5);
    }

    @Test
    void get_outOfRange_throws() {
        assertThatThrownBy(() -> M.get(9)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> M.get(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> M.get(3, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> M.get(0, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void rowAndColumn() {
        assertThat(M.row(1)).isEqualTo(Matrix3x1.of(4, 5, 6));
        assertThat(M.column(1)).isEqualTo(Matrix3x1.of(2, 5, 8));
    }

    @Test
    void multiply_vector_dotsEveryRow() {
        assertThat(M.multiply(Matrix3x1.of(1, 0, -1))).isEqualTo(Matrix3x1.of(-2, -2, -3));
    }

    @Test
    void multiply_identity_isNeutral() {
        assertThat(M.multiply(Matrix3x3.IDENTITY)).isEqualTo(M);
        assertThat(Matrix3x3.IDENTITY.multiply(M)).isEqualTo(M);
    }

    @Test
    void multiply_matrix() {
        Matrix3x3 other = new Matrix3x3(
                0, 1, 0,
                1, 0, 0,
                0, 0, 2);

        assertThat(M.multiply(other)).isEqualTo(new Matrix3x3(
                2, 1, 6,
                5, 4, 12,
                8, 7, 20));
    }

    @Test
    void pow_isElementWise() {
        assertThat(M.pow(2)).isEqualTo(new Matrix3x3(
                1, 4, 9,
                16, 25, 36,
                49, 64, 100));
    }

    @Test
    void diagonal_and_fromColumns() {
        assertThat(Matrix3x3.diagonal(Matrix3x1.of(1, 2, 3))).isEqualTo(new Matrix3x3(
                1, 0, 0,
                0, 2, 0,
                0, 0, 3));
        assertThat(Matrix3x3.fromColumns(M.column(0), M.column(1), M.column(2))).isEqualTo(M);
    }

    @Test
    void inverse_timesMatrix_isIdentity() {
        assertThat(M.determinant()).isCloseTo(-3.0, within(1e-12));

        Matrix3x3 product = M.multiply(M.inverse());

        for (int i = 0; i < 9; i++) {
            assertThat(product.get(i)).isCloseTo(Matrix3x3.IDENTITY.get(i), within(1e-12));
        }
    }

    @Test
    void inverse_singular_throws() {
        Matrix3x3 singular = new Matrix3x3(
                1, 2, 3,
                2, 4, 6,
                0, 0, 1);

        assertThatThrownBy(singular::inverse).isInstanceOf(ArithmeticException.class);
    }
}
