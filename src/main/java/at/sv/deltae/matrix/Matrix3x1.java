package at.sv.deltae.matrix;

/**
 * A column vector of three doubles, used for white points, cone responses and XYZ / linear RGB / raw Lab triples.
 */
public record Matrix3x1(double x, double y, double z) {

    public static Matrix3x1 of(double x, double y, double z) {
        return new Matrix3x1(x, y, z);
    }

    /**
     * @param index 0 (x), 1 (y) or 2 (z)
     * @throws IndexOutOfBoundsException for any other index
     */
    public double get(int index) {
        switch (index) {
            case 0:
                return x;
            case 1:
                return y;
            case 2:
                return z;
            default:
                throw new IndexOutOfBoundsException("index out of bounds: the height is 3, but the index is " + index);
        }
    }

    /**
     * Raises every component to the given exponent. Negative bases with a non integer exponent yield NaN.
     */
    public Matrix3x1 pow(double exponent) {
        return new Matrix3x1(Math.pow(x, exponent), Math.pow(y, exponent), Math.pow(z, exponent));
    }

    public boolean hasZeroComponent() {
        return x == 0.0 || y == 0.0 || z == 0.0;
    }

    @Override
    public String toString() {
        return "[" + x + "; " + y + "; " + z + ']';
    }
}
