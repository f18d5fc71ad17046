package at.sv.deltae.color;

import at.sv.deltae.DeltaEq;
import at.sv.deltae.FormatUtil;
import at.sv.deltae.illuminant.Illuminant;
import at.sv.deltae.matrix.Matrix3x1;

/**
 * Polar form of {@link LabValue}: lightness [0, 100], chroma [0, 181.0193] and hue angle in degrees [0, 360].
 * Construction fails with {@link OutOfBounds} if any value is outside of its range.
 */
public record LchValue(double l, double c, double h) implements DeltaEq {

    /**
     * Chroma of the Lab corner (±128, ±128).
     */
    public static final double MAX_C = Math.sqrt(LabValue.MAX_AB * LabValue.MAX_AB * 2);
    public static final double MAX_H = 360.0;

    public LchValue {
        if (!Bounds.isInRange(l, LabValue.MIN_L, LabValue.MAX_L)
            || !Bounds.isInRange(c, 0.0, MAX_C)
            || !Bounds.isInRange(h, 0.0, MAX_H)) {
            throw new OutOfBounds(format(l, c, h));
        }
    }

    public static LchValue of(double l, double c, double h) {
        return new LchValue(l, c, h);
    }

    /**
     * Parses {@code "L, c, h"}.
     *
     * @throws BadFormat   if the text is not three comma separated numbers
     * @throws OutOfBounds if a value is outside of its range
     */
    public static LchValue parse(String text) {
        double[] values = ColorValueParser.parseDecimals(text);
        return new LchValue(values[0], values[1], values[2]);
    }

    static LchValue converted(double l, double c, double h) {
        return new LchValue(Bounds.snap(l, LabValue.MIN_L, LabValue.MAX_L), Bounds.snap(c, 0.0, MAX_C), h);
    }

    public double hueRadians() {
        return Math.toRadians(h);
    }

    /**
     * @throws OutOfBounds if a or b of the cartesian form leave [-128, 128], e.g. for a chroma above 128 at hue 0
     */
    @Override
    public LabValue toLab() {
        return ColorConverter.lchToLab(this);
    }

    /**
     * Defined for every valid value, including the chroma/hue combinations {@link #toLab()} rejects.
     */
    @Override
    public Matrix3x1 labComponents() {
        return ColorConverter.lchToLabComponents(this);
    }

    public XyzValue toXyz() {
        return toLab().toXyz();
    }

    public XyzValue toXyz(Illuminant illuminant) {
        return toLab().toXyz(illuminant);
    }

    public LchValue roundTo(int places) {
        return new LchValue(FormatUtil.roundTo(l, places), FormatUtil.roundTo(c, places), FormatUtil.roundTo(h, places));
    }

    public String format(int precision) {
        return "[L:" + FormatUtil.formatNumber(l, precision)
               + ", c:" + FormatUtil.formatNumber(c, precision)
               + ", h:" + FormatUtil.formatNumber(h, precision) + ']';
    }

    @Override
    public String toString() {
        return format(l, c, h);
    }

    private static String format(double l, double c, double h) {
        return "[L:" + FormatUtil.formatNumber(l) + ", c:" + FormatUtil.formatNumber(c) + ", h:" + FormatUtil.formatNumber(h) + ']';
    }
}
