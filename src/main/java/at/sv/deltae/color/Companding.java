package at.sv.deltae.color;

/**
 * Transfer curve between stored (companded) RGB values and linear light, both on a scale from 0 to 1.
 */
public enum Companding {
    /**
     * IEC 61966-2-1
     */
    SRGB {
        private static final double GAMMA = 2.4;
        private static final double TRANSITION = 0.0031308; // linear domain
        private static final double COMPANDED_TRANSITION = 0.04045;
        private static final double SLOPE = 12.92;
        private static final double OFFSET = 0.055;

        @Override
        public double expand(double value) {
            if (value <= COMPANDED_TRANSITION) {
                return value / SLOPE;
            }
            return Math.pow((value + OFFSET) / (1 + OFFSET), GAMMA);
        }

        @Override
        public double compress(double value) {
            if (value <= TRANSITION) {
                return value * SLOPE;
            }
            return (1 + OFFSET) * Math.pow(value, 1.0 / GAMMA) - OFFSET;
        }
    },
    LINEAR {
        @Override
        public double expand(double value) {
            return value;
        }

        @Override
        public double compress(double value) {
            return value;
        }
    };

    /**
     * Stored value to linear light.
     */
    public abstract double expand(double value);

    /**
     * Linear light to stored value.
     */
    public abstract double compress(double value);
}
