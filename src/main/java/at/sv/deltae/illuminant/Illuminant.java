package at.sv.deltae.illuminant;

import at.sv.deltae.color.XyzValue;
import at.sv.deltae.matrix.Matrix3x1;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * Reference white points (2° observer, Y normalized to 1.0).
 * <p>
 * Two illuminants are equal when their white points are equal, regardless of their name. An illuminant created with
 * {@link #other(double, double, double)} using the D65 white point therefore equals {@link #D65}.
 * <p>
 * See: <a href="http://www.brucelindbloom.com/index.html?Eqn_ChromAdapt.html">Bruce Lindbloom: Chromatic Adaptation</a>
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Illuminant {

    /** Tungsten-filament (incandescent), 2856 K */
    public static final Illuminant A = new Illuminant("A", 1.09850, 1.00000, 0.35585);
    /** Direct sunlight at noon, 4874 K */
    public static final Illuminant B = new Illuminant("B", 0.99072, 1.00000, 0.85223);
    /** Average daylight, 6774 K */
    public static final Illuminant C = new Illuminant("C", 0.98074, 1.00000, 1.18232);
    /** Horizon daylight, 5003 K */
    public static final Illuminant D50 = new Illuminant("D50", 0.96422, 1.00000, 0.82521);
    /** Mid-morning daylight, 5503 K */
    public static final Illuminant D55 = new Illuminant("D55", 0.95682, 1.00000, 0.92149);
    /** Noon daylight, 6504 K */
    public static final Illuminant D65 = new Illuminant("D65", 0.95047, 1.00000, 1.08883);
    /** North sky daylight, 7504 K */
    public static final Illuminant D75 = new Illuminant("D75", 0.94972, 1.00000, 1.22638);
    /** Equal energy radiator */
    public static final Illuminant E = new Illuminant("E", 1.00000, 1.00000, 1.00000);
    /** Cool white fluorescent */
    public static final Illuminant F2 = new Illuminant("F2", 0.99186, 1.00000, 0.67393);
    /** Broadband fluorescent */
    public static final Illuminant F7 = new Illuminant("F7", 0.95041, 1.00000, 1.08747);
    /** Narrowband fluorescent */
    public static final Illuminant F11 = new Illuminant("F11", 1.00962, 1.00000, 0.64350);

    private static final List<Illuminant> STANDARD = List.of(A, B, C, D50, D55, D65, D75, E, F2, F7, F11);
    private static final String OTHER = "Other";

    @Getter
    private final String name;
    @Getter
    @EqualsAndHashCode.Include
    private final Matrix3x1 whitePoint;

    private Illuminant(String name, double x, double y, double z) {
        this.name = name;
        this.whitePoint = new Matrix3x1(x, y, z);
    }

    /**
     * Any arbitrary white point. Chromatic adaptation rejects white points with a zero component.
     */
    public static Illuminant other(double x, double y, double z) {
        return new Illuminant(OTHER, x, y, z);
    }

    public static Illuminant other(Matrix3x1 whitePoint) {
        return other(whitePoint.x(), whitePoint.y(), whitePoint.z());
    }

    /**
     * @return the named standard illuminants, {@link #A} through {@link #F11}
     */
    public static List<Illuminant> standardIlluminants() {
        return STANDARD;
    }

    /**
     * Looks up a standard illuminant by its name, case insensitive.
     *
     * @throws IllegalArgumentException if there is no standard illuminant with this name
     */
    public static Illuminant parse(String name) {
        String trimmed = name.trim();
        for (Illuminant illuminant : STANDARD) {
            if (illuminant.name.equalsIgnoreCase(trimmed)) {
                return illuminant;
            }
        }
        throw new IllegalArgumentException("Unknown illuminant '" + name + "'. Supported values (case insensitive): "
                                           + STANDARD.stream().map(Illuminant::getName).toList());
    }

    public boolean isStandard() {
        return !OTHER.equals(name);
    }

    /**
     * @return the white point as an XYZ value relative to this illuminant
     */
    public XyzValue xyz() {
        return XyzValue.of(whitePoint, this);
    }

    /**
     * @return the white point in the cone response domain of the given adaptation method
     */
    public Matrix3x1 coneResponse(ChromaticAdaptationMethod method) {
        return method.getConeResponseMatrix().multiply(whitePoint);
    }

    @Override
    public String toString() {
        if (isStandard()) {
            return name;
        }
        return OTHER + whitePoint;
    }
}
