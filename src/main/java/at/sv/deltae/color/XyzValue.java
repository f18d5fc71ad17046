package at.sv.deltae.color;

import at.sv.deltae.DeltaEq;
import at.sv.deltae.FormatUtil;
import at.sv.deltae.illuminant.ChromaticAdaptation;
import at.sv.deltae.illuminant.ChromaticAdaptationMethod;
import at.sv.deltae.illuminant.Illuminant;
import at.sv.deltae.matrix.Matrix3x1;

import java.util.Objects;

/**
 * CIE XYZ tristimulus values, scaled so that the white point of {@link #illuminant()} has Y = 1.0.
 * <p>
 * The components are not bounded, they only need to be finite: a value only has meaning together with the
 * illuminant it is relative to. Values created without an illuminant are relative to {@link Illuminant#D50}.
 */
public record XyzValue(double x, double y, double z, Illuminant illuminant) implements DeltaEq {

    public XyzValue {
        Objects.requireNonNull(illuminant, "illuminant");
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new OutOfBounds(format(x, y, z));
        }
    }

    public static XyzValue of(double x, double y, double z) {
        return new XyzValue(x, y, z, Illuminant.D50);
    }

    public static XyzValue of(double x, double y, double z, Illuminant illuminant) {
        return new XyzValue(x, y, z, illuminant);
    }

    public static XyzValue of(Matrix3x1 xyz, Illuminant illuminant) {
        return new XyzValue(xyz.x(), xyz.y(), xyz.z(), illuminant);
    }

    /**
     * Parses {@code "X, Y, Z"} relative to {@link Illuminant#D50}.
     *
     * @throws BadFormat   if the text is not three comma separated numbers
     * @throws OutOfBounds if a value is not finite
     */
    public static XyzValue parse(String text) {
        return parse(text, Illuminant.D50);
    }

    public static XyzValue parse(String text, Illuminant illuminant) {
        double[] values = ColorValueParser.parseDecimals(text);
        return new XyzValue(values[0], values[1], values[2], illuminant);
    }

    public Matrix3x1 toMatrix() {
        return new Matrix3x1(x, y, z);
    }

    /**
     * @return Lab relative to the white point of this value's illuminant
     * @throws OutOfBounds if the value lies outside of what Lab can represent, e.g. Y above the white point
     */
    @Override
    public LabValue toLab() {
        return ColorConverter.xyzToLab(this);
    }

    /**
     * Defined for every finite value, including values above the white point that {@link #toLab()} rejects.
     */
    @Override
    public Matrix3x1 labComponents() {
        return ColorConverter.xyzToLabComponents(this);
    }

    public LchValue toLch() {
        return toLab().toLch();
    }

    /**
     * @return sRGB, clamped to its gamut
     */
    public RgbValue toRgb() {
        return toRgb(RgbSystem.DEFAULT);
    }

    /**
     * Adapts the value with {@link ChromaticAdaptationMethod#BRADFORD} first, if the system uses another illuminant.
     *
     * @return RGB, clamped to the gamut of the system
     */
    public RgbValue toRgb(RgbSystem system) {
        return ColorConverter.xyzToRgb(this, system);
    }

    /**
     * Chromatic adaptation to the given illuminant using {@link ChromaticAdaptationMethod#BRADFORD}.
     */
    public XyzValue adapt(Illuminant destination) {
        return adapt(destination, ChromaticAdaptationMethod.BRADFORD);
    }

    /**
     * @return this value unchanged if it already is relative to the destination
     * @throws IllegalArgumentException if either white point has a zero component
     */
    public XyzValue adapt(Illuminant destination, ChromaticAdaptationMethod method) {
        return ChromaticAdaptation.adapt(this, destination, method);
    }

    public XyzValue roundTo(int places) {
        return new XyzValue(FormatUtil.roundTo(x, places), FormatUtil.roundTo(y, places), FormatUtil.roundTo(z, places),
                illuminant);
    }

    public String format(int precision) {
        return "[X:" + FormatUtil.formatNumber(x, precision)
               + ", Y:" + FormatUtil.formatNumber(y, precision)
               + ", Z:" + FormatUtil.formatNumber(z, precision) + ']';
    }

    @Override
    public String toString() {
        return format(x, y, z);
    }

    private static String format(double x, double y, double z) {
        return "[X:" + FormatUtil.formatNumber(x) + ", Y:" + FormatUtil.formatNumber(y) + ", Z:" + FormatUtil.formatNumber(z) + ']';
    }
}
