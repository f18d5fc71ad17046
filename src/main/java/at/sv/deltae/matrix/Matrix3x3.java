package at.sv.deltae.matrix;

/**
 * A 3x3 matrix of doubles, stored row-major.
 * <p>
 * {@code mRC} is the cell in row {@code R} and column {@code C}. The linear index of a cell is {@code row * 3 + column},
 * which is the order the constructor takes its arguments in, so constant tables can be written the way they read:
 * <pre>
 * new Matrix3x3(
 *         m00, m01, m02,
 *         m10, m11, m12,
 *         m20, m21, m22);
 * </pre>
 * Multiplying with a {@link Matrix3x1} is the standard linear map {@code M * v}, i.e. every row is dotted with the
 * column vector.
 */
public record Matrix3x3(double m00, double m01, double m02,
                        double m10, double m11, double m12,
                        double m20, double m21, double m22) {

    public static final Matrix3x3 IDENTITY = new Matrix3x3(
            1.0, 0.0, 0.0,
            0.0, 1.0, 0.0,
            0.0, 0.0, 1.0);

    public static Matrix3x3 diagonal(Matrix3x1 diagonal) {
        return new Matrix3x3(
                diagonal.x(), 0.0, 0.0,
                0.0, diagonal.y(), 0.0,
                0.0, 0.0, diagonal.z());
    }

    /**
     * Builds a matrix whose columns are the given vectors. For an RGB to XYZ matrix the columns are the XYZ values
     * of the red, green and blue primaries.
     */
    public static Matrix3x3 fromColumns(Matrix3x1 first, Matrix3x1 second, Matrix3x1 third) {
        return new Matrix3x3(
                first.x(), second.x(), third.x(),
                first.y(), second.y(), third.y(),
                first.z(), second.z(), third.z());
    }

    /**
     * @param index linear row-major index [0..8]
     * @throws IndexOutOfBoundsException if the index is outside of [0..8]
     */
    public double get(int index) {
        switch (index) {
            case 0:
                return m00;
            case 1:
                return m01;
            case 2:
                return m02;
            case 3:
                return m10;
            case 4:
                return m11;
            case 5:
                return m12;
            case 6:
                return m20;
            case 7:
                return m21;
            case 8:
                return m22;
            default:
                throw new IndexOutOfBoundsException("index out of bounds: the size is 9, but the index is " + index);
        }
    }

    /**
     * @param column [0..2]
     * @param row    [0..2]
     * @throws IndexOutOfBoundsException if either coordinate is outside of [0..2]
     */
    public double get(int column, int row) {
        if (column < 0 || column > 2) {
            throw new IndexOutOfBoundsException("index out of bounds: the width is 3, but the column index is " + column);
        }
        if (row < 0 || row > 2) {
            throw new IndexOutOfBoundsException("index out of bounds: the height is 3, but the row index is " + row);
        }
        return get(row * 3 + column);
    }

    public Matrix3x1 row(int row) {
        return new Matrix3x1(get(0, row), get(1, row), get(2, row));
    }

    public Matrix3x1 column(int column) {
        return new Matrix3x1(get(column, 0), get(column, 1), get(column, 2));
    }

    public Matrix3x3 multiply(Matrix3x3 other) {
        double[] product = new double[9];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                product[row * 3 + column] = get(0, row) * other.get(column, 0)
                                            + get(1, row) * other.get(column, 1)
                                            + get(2, row) * other.get(column, 2);
            }
        }
        return of(product);
    }

    public Matrix3x1 multiply(Matrix3x1 vector) {
        return new Matrix3x1(
                m00 * vector.x() + m01 * vector.y() + m02 * vector.z(),
                m10 * vector.x() + m11 * vector.y() + m12 * vector.z(),
                m20 * vector.x() + m21 * vector.y() + m22 * vector.z());
    }

    /**
     * Element-wise power, not a matrix power. NaN is propagated for negative entries and non integer exponents.
     */
    public Matrix3x3 pow(double exponent) {
        double[] result = new double[9];
        for (int i = 0; i < 9; i++) {
            result[i] = Math.pow(get(i), exponent);
        }
        return of(result);
    }

    public double determinant() {
        return m00 * (m11 * m22 - m12 * m21)
               - m01 * (m10 * m22 - m12 * m20)
               + m02 * (m10 * m21 - m11 * m20);
    }

    /**
     * @throws ArithmeticException if the matrix is singular
     */
    public Matrix3x3 inverse() {
        double det = determinant();
        if (det == 0.0) {
            throw new ArithmeticException("Matrix is singular: " + this);
        }
        return new Matrix3x3(
                (m11 * m22 - m12 * m21) / det, (m02 * m21 - m01 * m22) / det, (m01 * m12 - m02 * m11) / det,
                (m12 * m20 - m10 * m22) / det, (m00 * m22 - m02 * m20) / det, (m02 * m10 - m00 * m12) / det,
                (m10 * m21 - m11 * m20) / det, (m01 * m20 - m00 * m21) / det, (m00 * m11 - m01 * m10) / det);
    }

    private static Matrix3x3 of(double[] values) {
        return new Matrix3x3(
                values[0], values[1], values[2],
                values[3], values[4], values[5],
                values[6], values[7], values[8]);
    }

    @Override
    public String toString() {
        return "[" + m00 + ", " + m01 + ", " + m02 + "; "
               + m10 + ", " + m11 + ", " + m12 + "; "
               + m20 + ", " + m21 + ", " + m22 + ']';
    }
}
