package at.sv.deltae.color;

import at.sv.deltae.DeltaEq;
import at.sv.deltae.FormatUtil;
import at.sv.deltae.illuminant.Illuminant;
import at.sv.deltae.matrix.Matrix3x1;

/**
 * CIE L*a*b*.
 * <table>
 *     <caption>Ranges</caption>
 *     <tr><th>Value</th><th>Color</th><th>Range</th></tr>
 *     <tr><td>L*</td><td>dark - light</td><td>[0, 100]</td></tr>
 *     <tr><td>a*</td><td>green - magenta</td><td>[-128, 128]</td></tr>
 *     <tr><td>b*</td><td>blue - yellow</td><td>[-128, 128]</td></tr>
 * </table>
 * Lab values are relative to the white point of the XYZ value they were derived from, D50 by default.
 * Construction fails with {@link OutOfBounds} if any value is outside of its range.
 */
public record LabValue(double l, double a, double b) implements DeltaEq {

    public static final double MIN_L = 0.0;
    public static final double MAX_L = 100.0;
    public static final double MIN_AB = -128.0;
    public static final double MAX_AB = 128.0;

    public LabValue {
        if (!Bounds.isInRange(l, MIN_L, MAX_L)
            || !Bounds.isInRange(a, MIN_AB, MAX_AB)
            || !Bounds.isInRange(b, MIN_AB, MAX_AB)) {
            throw new OutOfBounds(format(l, a, b));
        }
    }

    public static LabValue of(double l, double a, double b) {
        return new LabValue(l, a, b);
    }

    /**
     * Parses {@code "L, a, b"}.
     *
     * @throws BadFormat   if the text is not three comma separated numbers
     * @throws OutOfBounds if a value is outside of its range
     */
    public static LabValue parse(String text) {
        double[] values = ColorValueParser.parseDecimals(text);
        return new LabValue(values[0], values[1], values[2]);
    }

    /**
     * Creates the result of a conversion, tolerating floating point overshoot of the range.
     */
    static LabValue converted(double l, double a, double b) {
        return new LabValue(
                Bounds.snap(l, MIN_L, MAX_L),
                Bounds.snap(a, MIN_AB, MAX_AB),
                Bounds.snap(b, MIN_AB, MAX_AB));
    }

    static LabValue converted(Matrix3x1 components) {
        return converted(components.x(), components.y(), components.z());
    }

    @Override
    public LabValue toLab() {
        return this;
    }

    @Override
    public Matrix3x1 labComponents() {
        return toMatrix();
    }

    /**
     * @return (L*, a*, b*)
     */
    public Matrix3x1 toMatrix() {
        return new Matrix3x1(l, a, b);
    }

    public LchValue toLch() {
        return ColorConverter.labToLch(this);
    }

    /**
     * @return XYZ relative to {@link Illuminant#D50}
     */
    public XyzValue toXyz() {
        return toXyz(Illuminant.D50);
    }

    public XyzValue toXyz(Illuminant illuminant) {
        return ColorConverter.labToXyz(this, illuminant);
    }

    /**
     * @return sRGB, clamped to its gamut
     */
    public RgbValue toRgb() {
        return toRgb(RgbSystem.DEFAULT);
    }

    /**
     * Interprets this value relative to the illuminant of the given system.
     *
     * @return RGB, clamped to the gamut of the system
     */
    public RgbValue toRgb(RgbSystem system) {
        return toXyz(system.getIlluminant()).toRgb(system);
    }

    public LabValue roundTo(int places) {
        return new LabValue(FormatUtil.roundTo(l, places), FormatUtil.roundTo(a, places), FormatUtil.roundTo(b, places));
    }

    public String format(int precision) {
        return "[L:" + FormatUtil.formatNumber(l, precision)
               + ", a:" + FormatUtil.formatNumber(a, precision)
               + ", b:" + FormatUtil.formatNumber(b, precision) + ']';
    }

    @Override
    public String toString() {
        return format(l, a, b);
    }

    private static String format(double l, double a, double b) {
        return "[L:" + FormatUtil.formatNumber(l) + ", a:" + FormatUtil.formatNumber(a) + ", b:" + FormatUtil.formatNumber(b) + ']';
    }
}
