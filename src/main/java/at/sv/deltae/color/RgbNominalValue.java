package at.sv.deltae.color;

import at.sv.deltae.matrix.Matrix3x1;

/**
 * RGB on a scale from 0 to 1. Construction fails with {@link OutOfBounds} if a channel is outside of [0, 1]; results
 * of matrix math are passed through {@link #clamped(double, double, double)} instead.
 */
public record RgbNominalValue(double r, double g, double b) {

    public RgbNominalValue {
        if (!Bounds.isInRange(r, 0.0, 1.0) || !Bounds.isInRange(g, 0.0, 1.0) || !Bounds.isInRange(b, 0.0, 1.0)) {
            throw new OutOfBounds("[R:" + r + ", G:" + g + ", B:" + b + ']');
        }
    }

    /**
     * Clamps every channel into [0, 1]. NaN is mapped to 0.
     */
    public static RgbNominalValue clamped(double r, double g, double b) {
        return new RgbNominalValue(clamp(r), clamp(g), clamp(b));
    }

    static RgbNominalValue clamped(Matrix3x1 rgb) {
        return clamped(rgb.x(), rgb.y(), rgb.z());
    }

    /**
     * Scales to [0, 255], rounding to the nearest integer.
     */
    public RgbValue denominalize() {
        return new RgbValue(denominalize(r), denominalize(g), denominalize(b));
    }

    /**
     * Removes the companding of the given curve, i.e. converts stored values to linear light.
     */
    public RgbNominalValue linearize(Companding companding) {
        return new RgbNominalValue(companding.expand(r), companding.expand(g), companding.expand(b));
    }

    /**
     * Applies the given companding curve to linear light values.
     */
    public RgbNominalValue compand(Companding companding) {
        return clamped(companding.compress(r), companding.compress(g), companding.compress(b));
    }

    public Matrix3x1 toMatrix() {
        return new Matrix3x1(r, g, b);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), 1.0);
    }

    private static int denominalize(double value) {
        return (int) Math.round(value * RgbValue.MAX);
    }
}
