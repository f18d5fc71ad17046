package at.sv.deltae;

import java.util.Objects;

/**
 * A {@link DeltaE} used as the threshold for {@link DeltaEq}. Ordering compares the values only; the method tag is
 * not taken into account.
 * <p>
 * Note that {@link #equals(Object)} is not consistent with {@link #compareTo(Tolerance)}: equality is record
 * equality and includes the method, so {@code Tolerance.of(DE2000, 1)} and {@code Tolerance.of(DE1976, 1)} compare
 * as 0 but are not equal. Sorted collections treat them as duplicates.
 */
public record Tolerance(DeltaE deltaE) implements Comparable<Tolerance> {

    /**
     * A DE2000 value of 1.0, the commonly accepted "just noticeable difference".
     */
    public static final Tolerance DEFAULT = of(DEMethod.DE2000, 1.0);

    public Tolerance {
        Objects.requireNonNull(deltaE, "deltaE");
    }

    public static Tolerance of(DEMethod method, double value) {
        return new Tolerance(new DeltaE(method, value));
    }

    public DEMethod method() {
        return deltaE.method();
    }

    public double value() {
        return deltaE.value();
    }

    public boolean isSatisfiedBy(DeltaE measured) {
        return measured.value() <= value();
    }

    @Override
    public int compareTo(Tolerance other) {
        return deltaE.compareTo(other.deltaE);
    }

    @Override
    public String toString() {
        return deltaE.toString();
    }
}
