package at.sv.deltae;

/**
 * Equality within a {@link Tolerance}, defined purely in terms of {@link Delta}.
 */
public interface DeltaEq extends Delta {

    /**
     * @return true if the difference, measured with the tolerance's method, is not larger than the tolerance's value
     */
    default boolean deltaEq(Delta other, Tolerance tolerance) {
        return tolerance.isSatisfiedBy(delta(other, tolerance.method()));
    }

    /**
     * Uses {@link Tolerance#DEFAULT}, a DE2000 value of 1.0.
     */
    default boolean deltaEq(Delta other) {
        return deltaEq(other, Tolerance.DEFAULT);
    }
}
