package at.sv.deltae;

import at.sv.deltae.color.ColorConverter;
import at.sv.deltae.matrix.Matrix3x1;

/**
 * The color difference formulas, operating on (L*, a*, b*) triples stored as {@link Matrix3x1} (x = L*, y = a*,
 * z = b*). The components are not required to lie within the Lab ranges.
 * <p>
 * See: <a href="http://www.brucelindbloom.com/index.html?ColorDifferenceCalc.html">Bruce Lindbloom: Color Difference</a>
 * and <a href="https://hajim.rochester.edu/ece/sites/gsharma/ciede2000/">Sharma, Wu, Dalal: The CIEDE2000 Color-Difference Formula</a>
 */
final class DeltaECalculator {

    private static final double POW_25_7 = Math.pow(25.0, 7);

    private DeltaECalculator() {
    }

    static double cie1976(Matrix3x1 reference, Matrix3x1 sample) {
        double dL = reference.x() - sample.x();
        double da = reference.y() - sample.y();
        double db = reference.z() - sample.z();
        return Math.sqrt(dL * dL + da * da + db * db);
    }

    /**
     * CIE94 with the geometric mean chroma as weighting base, so that swapping the colors yields the same value.
     */
    static double cie1994(Matrix3x1 reference, Matrix3x1 sample, boolean textiles) {
        double kL = textiles ? 2.0 : 1.0;
        double k1 = textiles ? 0.048 : 0.045;
        double k2 = textiles ? 0.014 : 0.015;

        double c1 = chroma(reference);
        double c2 = chroma(sample);
        double dL = reference.x() - sample.x();
        double dC = c1 - c2;
        double dH2 = squaredHueDifference(reference, sample, dC);

        double cMean = Math.sqrt(c1 * c2);
        double sC = 1.0 + k1 * cMean;
        double sH = 1.0 + k2 * cMean;

        double lTerm = dL / kL;
        double cTerm = dC / sC;
        return Math.sqrt(lTerm * lTerm + cTerm * cTerm + dH2 / (sH * sH));
    }

    static double cie2000(Matrix3x1 reference, Matrix3x1 sample) {
        double l1 = reference.x();
        double l2 = sample.x();
        double lMean = (l1 + l2) / 2.0;

        double cMean = (chroma(reference) + chroma(sample)) / 2.0;
        double cMean7 = Math.pow(cMean, 7);
        double g = 0.5 * (1.0 - Math.sqrt(cMean7 / (cMean7 + POW_25_7)));

        double a1p = reference.y() * (1.0 + g);
        double a2p = sample.y() * (1.0 + g);
        double c1p = Math.hypot(a1p, reference.z());
        double c2p = Math.hypot(a2p, sample.z());
        double cpMean = (c1p + c2p) / 2.0;
        double h1p = c1p == 0 ? 0 : ColorConverter.hueAngle(a1p, reference.z());
        double h2p = c2p == 0 ? 0 : ColorConverter.hueAngle(a2p, sample.z());

        double dhp;
        if (c1p == 0 || c2p == 0) {
            dhp = 0;
        } else if (Math.abs(h2p - h1p) <= 180.0) {
            dhp = h2p - h1p;
        } else if (h2p - h1p > 180.0) {
            dhp = h2p - h1p - 360.0;
        } else {
            dhp = h2p - h1p + 360.0;
        }

        double dLp = l2 - l1;
        double dCp = c2p - c1p;
        double dHp = 2.0 * Math.sqrt(c1p * c2p) * Math.sin(Math.toRadians(dhp / 2.0));

        double hpMean;
        if (c1p == 0 || c2p == 0) {
            hpMean = h1p + h2p;
        } else if (Math.abs(h1p - h2p) <= 180.0) {
            hpMean = (h1p + h2p) / 2.0;
        } else if (h1p + h2p < 360.0) {
            hpMean = (h1p + h2p + 360.0) / 2.0;
        } else {
            hpMean = (h1p + h2p - 360.0) / 2.0;
        }

        double t = 1.0
                   - 0.17 * Math.cos(Math.toRadians(hpMean - 30.0))
                   + 0.24 * Math.cos(Math.toRadians(2.0 * hpMean))
                   + 0.32 * Math.cos(Math.toRadians(3.0 * hpMean + 6.0))
                   - 0.20 * Math.cos(Math.toRadians(4.0 * hpMean - 63.0));

        double lMean50Sq = (lMean - 50.0) * (lMean - 50.0);
        double sL = 1.0 + 0.015 * lMean50Sq / Math.sqrt(20.0 + lMean50Sq);
        double sC = 1.0 + 0.045 * cpMean;
        double sH = 1.0 + 0.015 * cpMean * t;

        double hueExp = (hpMean - 275.0) / 25.0;
        double dTheta = 30.0 * Math.exp(-hueExp * hueExp);
        double cpMean7 = Math.pow(cpMean, 7);
        double rC = 2.0 * Math.sqrt(cpMean7 / (cpMean7 + POW_25_7));
        double rT = -Math.sin(Math.toRadians(2.0 * dTheta)) * rC;

        double lTerm = dLp / sL;
        double cTerm = dCp / sC;
        double hTerm = dHp / sH;
        return Math.sqrt(lTerm * lTerm + cTerm * cTerm + hTerm * hTerm + rT * cTerm * hTerm);
    }

    /**
     * CMC l:c, weighted by lightness, chroma and hue of the reference.
     */
    static double cmc(Matrix3x1 reference, Matrix3x1 sample, double toleranceL, double toleranceC) {
        double l1 = reference.x();
        double c1 = chroma(reference);
        double c2 = chroma(sample);
        double dL = l1 - sample.x();
        double dC = c1 - c2;
        double dH2 = squaredHueDifference(reference, sample, dC);

        double sL = l1 < 16.0 ? 0.511 : 0.040975 * l1 / (1.0 + 0.01765 * l1);
        double sC = 0.0638 * c1 / (1.0 + 0.0131 * c1) + 0.638;
        double c1Pow4 = c1 * c1 * c1 * c1;
        double f = Math.sqrt(c1Pow4 / (c1Pow4 + 1900.0));
        double h1 = ColorConverter.hueAngle(reference.y(), reference.z());
        double t = h1 >= 164.0 && h1 <= 345.0
                ? 0.56 + Math.abs(0.2 * Math.cos(Math.toRadians(h1 + 168.0)))
                : 0.36 + Math.abs(0.4 * Math.cos(Math.toRadians(h1 + 35.0)));
        double sH = sC * (f * t + 1.0 - f);

        double lTerm = dL / (toleranceL * sL);
        double cTerm = dC / (toleranceC * sC);
        return Math.sqrt(lTerm * lTerm + cTerm * cTerm + dH2 / (sH * sH));
    }

    private static double chroma(Matrix3x1 lab) {
        return Math.hypot(lab.y(), lab.z());
    }

    /**
     * dH^2 = da^2 + db^2 - dC^2, clamped at 0 against rounding.
     */
    private static double squaredHueDifference(Matrix3x1 reference, Matrix3x1 sample, double dC) {
        double da = reference.y() - sample.y();
        double db = reference.z() - sample.z();
        return Math.max(0.0, da * da + db * db - dC * dC);
    }
}
