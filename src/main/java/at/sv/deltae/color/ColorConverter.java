package at.sv.deltae.color;

import at.sv.deltae.illuminant.ChromaticAdaptationMethod;
import at.sv.deltae.illuminant.Illuminant;
import at.sv.deltae.matrix.Matrix3x1;
import lombok.extern.slf4j.Slf4j;

/**
 * Conversions between Lab, Lch, XYZ and RGB.
 * <p>
 * See: <a href="http://www.brucelindbloom.com/index.html?Math.html">Bruce Lindbloom: Color Math</a>
 */
@Slf4j
public final class ColorConverter {

    /**
     * CIE standard, exact form of 903.3
     */
    static final double KAPPA = 24389.0 / 27.0;
    /**
     * CIE standard, exact form of 0.008856
     */
    static final double EPSILON = 216.0 / 24389.0;
    static final double CBRT_EPSILON = Math.cbrt(EPSILON);

    private ColorConverter() {
    }

    /**
     * Hue angle of (a, b) in degrees, normalized into [0, 360).
     */
    public static double hueAngle(double a, double b) {
        double h = Math.toDegrees(Math.atan2(b, a));
        if (h < 0) {
            h += 360.0;
        }
        return h;
    }

    static LchValue labToLch(LabValue lab) {
        return LchValue.converted(lab.l(), Math.sqrt(lab.a() * lab.a() + lab.b() * lab.b()), hueAngle(lab.a(), lab.b()));
    }

    static LabValue lchToLab(LchValue lch) {
        return LabValue.converted(lchToLabComponents(lch));
    }

    /**
     * @return (L*, a*, b*), not range checked: a and b may exceed [-128, 128] for large chroma
     */
    static Matrix3x1 lchToLabComponents(LchValue lch) {
        double h = lch.hueRadians();
        return new Matrix3x1(lch.l(), lch.c() * Math.cos(h), lch.c() * Math.sin(h));
    }

    static LabValue xyzToLab(XyzValue xyz) {
        return LabValue.converted(xyzToLabComponents(xyz));
    }

    /**
     * @return (L*, a*, b*) relative to the value's illuminant, not range checked
     */
    static Matrix3x1 xyzToLabComponents(XyzValue xyz) {
        Matrix3x1 white = xyz.illuminant().getWhitePoint();
        double fx = labF(xyz.x() / white.x());
        double fy = labF(xyz.y() / white.y());
        double fz = labF(xyz.z() / white.z());
        return new Matrix3x1(116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz));
    }

    static XyzValue labToXyz(LabValue lab, Illuminant illuminant) {
        double fy = (lab.l() + 16.0) / 116.0;
        double fx = lab.a() / 500.0 + fy;
        double fz = fy - lab.b() / 200.0;

        double xr = fx > CBRT_EPSILON ? fx * fx * fx : (116.0 * fx - 16.0) / KAPPA;
        double yr = lab.l() > KAPPA * EPSILON ? fy * fy * fy : lab.l() / KAPPA;
        double zr = fz > CBRT_EPSILON ? fz * fz * fz : (116.0 * fz - 16.0) / KAPPA;

        Matrix3x1 white = illuminant.getWhitePoint();
        return XyzValue.of(xr * white.x(), yr * white.y(), zr * white.z(), illuminant);
    }

    static XyzValue rgbToXyz(RgbValue rgb, RgbSystem system) {
        RgbNominalValue linear = rgb.nominalize().linearize(system.getCompanding());
        return XyzValue.of(system.getRgbToXyz().multiply(linear.toMatrix()), system.getIlluminant());
    }

    static RgbValue xyzToRgb(XyzValue xyz, RgbSystem system) {
        XyzValue adapted = xyz.adapt(system.getIlluminant(), ChromaticAdaptationMethod.BRADFORD);
        Matrix3x1 linear = system.getXyzToRgb().multiply(adapted.toMatrix());
        RgbNominalValue clamped = RgbNominalValue.clamped(linear);
        if (!clamped.toMatrix().equals(linear)) {
            log.trace("Clamped {} to the gamut of {}: {} -> {}", xyz, system, linear, clamped);
        }
        return clamped.compand(system.getCompanding()).denominalize();
    }

    private static double labF(double t) {
        return t > EPSILON ? Math.cbrt(t) : (KAPPA * t + 16.0) / 116.0;
    }
}
