package at.sv.deltae.color;

/**
 * Range checks shared by the validating value types.
 */
final class Bounds {

    /**
     * Largest overshoot of a conversion result that is still treated as floating point noise.
     */
    static final double SNAP_TOLERANCE = 1e-4;

    private Bounds() {
    }

    /**
     * NaN is never in range.
     */
    static boolean isInRange(double value, double min, double max) {
        return value >= min && value <= max;
    }

    /**
     * Moves a value that lies just outside [min, max] onto the nearest bound. Values further out are returned
     * unchanged, so that the validating constructor rejects them.
     */
    static double snap(double value, double min, double max) {
        if (value < min && value >= min - SNAP_TOLERANCE) {
            return min;
        }
        if (value > max && value <= max + SNAP_TOLERANCE) {
            return max;
        }
        return value;
    }
}
