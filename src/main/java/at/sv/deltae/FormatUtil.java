package at.sv.deltae;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

public final class FormatUtil {
    private FormatUtil() {
    }

    /**
     * Shortest representation of the value, without a trailing ".0" for integral values.
     */
    public static String formatNumber(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * @param precision number of decimal places, >= 0
     */
    public static String formatNumber(double value, int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must be >= 0, got " + precision);
        }
        return String.format(Locale.ROOT, "%." + precision + "f", value);
    }

    /**
     * Rounds half up to the given number of decimal places.
     */
    public static double roundTo(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
