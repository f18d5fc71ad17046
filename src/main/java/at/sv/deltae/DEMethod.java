package at.sv.deltae;

import at.sv.deltae.color.LabValue;
import at.sv.deltae.matrix.Matrix3x1;

import java.util.Locale;

/**
 * The supported color difference formulas. The set is closed: every variant has to provide
 * {@link #calculate(LabValue, LabValue)}, so adding a formula means adding a permitted variant here.
 */
public sealed interface DEMethod permits DEMethod.Cie1976, DEMethod.Cie1994, DEMethod.Cie2000, DEMethod.Cmc {

    DEMethod DE1976 = new Cie1976();
    /**
     * CIE94, weighted for graphic arts
     */
    DEMethod DE1994 = new Cie1994(false);
    /**
     * CIE94, weighted for textiles
     */
    DEMethod DE1994T = new Cie1994(true);
    DEMethod DE2000 = new Cie2000();
    /**
     * CMC l:c (1:1), imperceptibility
     */
    DEMethod DECMC1 = new Cmc(1.0, 1.0);
    /**
     * CMC l:c (2:1), acceptability
     */
    DEMethod DECMC2 = new Cmc(2.0, 1.0);
    DEMethod DEFAULT = DE2000;

    /**
     * @param reference the standard; only {@link Cmc} depends on which color is the reference
     * @param sample    the color compared against the reference
     * @return the color difference, >= 0
     */
    default double calculate(LabValue reference, LabValue sample) {
        return calculate(reference.toMatrix(), sample.toMatrix());
    }

    /**
     * Same as {@link #calculate(LabValue, LabValue)} on raw (L*, a*, b*) components, which may lie outside the
     * Lab ranges.
     */
    double calculate(Matrix3x1 reference, Matrix3x1 sample);

    /**
     * Same as {@link #toString()}, with the numeric parameters, if any, printed with the given number of decimals.
     */
    String format(int precision);

    static DEMethod cmc(double toleranceL, double toleranceC) {
        return new Cmc(toleranceL, toleranceC);
    }

    /**
     * Parses the case insensitive method aliases, e.g. {@code "de2000"}, {@code "00"}, {@code "cmc2"} or
     * {@code "94t"}.
     *
     * @throws IllegalArgumentException for unknown aliases
     */
    static DEMethod parse(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "de2000":
            case "de00":
            case "2000":
            case "00":
                return DE2000;
            case "de1976":
            case "de76":
            case "1976":
            case "76":
                return DE1976;
            case "de1994":
            case "de94":
            case "1994":
            case "94":
            case "de1994g":
            case "de94g":
            case "1994g":
            case "94g":
                return DE1994;
            case "de1994t":
            case "de94t":
            case "1994t":
            case "94t":
                return DE1994T;
            case "decmc":
            case "decmc1":
            case "cmc1":
            case "cmc":
                return DECMC1;
            case "decmc2":
            case "cmc2":
                return DECMC2;
            default:
                throw new IllegalArgumentException("Unknown DeltaE method '" + value + "'. Supported values (case insensitive): "
                                                   + "[de2000|de00|2000|00, de1976|de76|1976|76, de1994|de94|1994|94, "
                                                   + "de1994t|de94t|1994t|94t, decmc|decmc1|cmc1|cmc, decmc2|cmc2]");
        }
    }

    /**
     * Euclidean distance in Lab.
     */
    record Cie1976() implements DEMethod {
        @Override
        public double calculate(Matrix3x1 reference, Matrix3x1 sample) {
            return DeltaECalculator.cie1976(reference, sample);
        }

        @Override
        public String format(int precision) {
            return toString();
        }

        @Override
        public String toString() {
            return "DE1976";
        }
    }

    /**
     * @param textiles use the textile weighting (kL = 2, K1 = 0.048, K2 = 0.014) instead of graphic arts
     *                 (kL = 1, K1 = 0.045, K2 = 0.015)
     */
    record Cie1994(boolean textiles) implements DEMethod {
        @Override
        public double calculate(Matrix3x1 reference, Matrix3x1 sample) {
            return DeltaECalculator.cie1994(reference, sample, textiles);
        }

        @Override
        public String format(int precision) {
            return toString();
        }

        @Override
        public String toString() {
            return textiles ? "DE1994T" : "DE1994";
        }
    }

    record Cie2000() implements DEMethod {
        @Override
        public double calculate(Matrix3x1 reference, Matrix3x1 sample) {
            return DeltaECalculator.cie2000(reference, sample);
        }

        @Override
        public String format(int precision) {
            return toString();
        }

        @Override
        public String toString() {
            return "DE2000";
        }
    }

    /**
     * CMC l:c. Not symmetric: the weighting is derived from the reference color.
     *
     * @param toleranceL lightness weight l, > 0
     * @param toleranceC chroma weight c, > 0
     */
    record Cmc(double toleranceL, double toleranceC) implements DEMethod {

        public Cmc {
            if (!(toleranceL > 0) || !(toleranceC > 0) || Double.isInfinite(toleranceL) || Double.isInfinite(toleranceC)) {
                throw new IllegalArgumentException("CMC tolerances must be finite and > 0, got l=" + toleranceL
                                                   + ", c=" + toleranceC);
            }
        }

        @Override
        public double calculate(Matrix3x1 reference, Matrix3x1 sample) {
            return DeltaECalculator.cmc(reference, sample, toleranceL, toleranceC);
        }

        @Override
        public String format(int precision) {
            return "DECMC(" + FormatUtil.formatNumber(toleranceL, precision) + ":"
                   + FormatUtil.formatNumber(toleranceC, precision) + ")";
        }

        @Override
        public String toString() {
            return "DECMC(" + FormatUtil.formatNumber(toleranceL) + ":" + FormatUtil.formatNumber(toleranceC) + ")";
        }
    }
}
