package at.sv.deltae;

import at.sv.deltae.color.LabValue;

import java.util.Objects;

/**
 * The measured difference between two colors.
 * <p>
 * Ordering only compares {@link #value()}. Be careful when ordering values of different methods: a DE2000 value of
 * 1.0 is not the same amount of color difference as a DE1976 value of 1.0.
 */
public record DeltaE(DEMethod method, double value) implements Comparable<DeltaE> {

    public DeltaE {
        Objects.requireNonNull(method, "method");
    }

    public static DeltaE between(Delta reference, Delta sample, DEMethod method) {
        return new DeltaE(method, method.calculate(reference.labComponents(), sample.labComponents()));
    }

    public static DeltaE between(LabValue reference, LabValue sample, DEMethod method) {
        return new DeltaE(method, method.calculate(reference, sample));
    }

    public DeltaE roundTo(int places) {
        return new DeltaE(method, FormatUtil.roundTo(value, places));
    }

    public Tolerance toTolerance() {
        return new Tolerance(this);
    }

    @Override
    public int compareTo(DeltaE other) {
        return Double.compare(value, other.value);
    }

    /**
     * @return e.g. {@code "5.3169 DE2000"} or {@code "1.0000 DECMC(1.0000:1.0000)"}
     */
    public String format(int precision) {
        return FormatUtil.formatNumber(value, precision) + " " + method.format(precision);
    }

    /**
     * @return e.g. {@code "1 DE2000"}
     */
    @Override
    public String toString() {
        return FormatUtil.formatNumber(value) + " " + method;
    }
}
