package at.sv.deltae.color;

import at.sv.deltae.DeltaEq;
import at.sv.deltae.matrix.Matrix3x1;

/**
 * 8 bit device RGB. Its meaning depends on the {@link RgbSystem} it is interpreted in; sRGB unless stated otherwise.
 * Construction fails with {@link OutOfBounds} if a channel is outside of [0, 255].
 */
public record RgbValue(int r, int g, int b) implements DeltaEq {

    public static final int MAX = 255;

    public RgbValue {
        if (r < 0 || r > MAX || g < 0 || g > MAX || b < 0 || b > MAX) {
            throw new OutOfBounds(format(r, g, b));
        }
    }

    public static RgbValue of(int r, int g, int b) {
        return new RgbValue(r, g, b);
    }

    /**
     * Parses {@code "r, g, b"}.
     *
     * @throws BadFormat   if the text is not three comma separated integers
     * @throws OutOfBounds if a channel is outside of [0, 255]
     */
    public static RgbValue parse(String text) {
        int[] values = ColorValueParser.parseIntegers(text);
        return new RgbValue(values[0], values[1], values[2]);
    }

    public RgbValue invert() {
        return new RgbValue(MAX - r, MAX - g, MAX - b);
    }

    public RgbNominalValue nominalize() {
        return new RgbNominalValue(r / (double) MAX, g / (double) MAX, b / (double) MAX);
    }

    /**
     * @return XYZ relative to the illuminant of {@link RgbSystem#DEFAULT}
     */
    public XyzValue toXyz() {
        return toXyz(RgbSystem.DEFAULT);
    }

    /**
     * @return XYZ relative to the illuminant of the given system
     */
    public XyzValue toXyz(RgbSystem system) {
        return ColorConverter.rgbToXyz(this, system);
    }

    /**
     * @return Lab relative to the white point of {@link RgbSystem#DEFAULT}
     */
    @Override
    public LabValue toLab() {
        return toLab(RgbSystem.DEFAULT);
    }

    public LabValue toLab(RgbSystem system) {
        return toXyz(system).toLab();
    }

    @Override
    public Matrix3x1 labComponents() {
        return toXyz().labComponents();
    }

    @Override
    public String toString() {
        return format(r, g, b);
    }

    private static String format(int r, int g, int b) {
        return "[R:" + r + ", G:" + g + ", B:" + b + ']';
    }
}
