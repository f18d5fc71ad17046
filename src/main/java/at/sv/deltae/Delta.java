package at.sv.deltae;

import at.sv.deltae.color.LabValue;
import at.sv.deltae.matrix.Matrix3x1;

/**
 * A color that can be measured against any other {@code Delta} by converting both to Lab.
 */
public interface Delta {

    /**
     * @throws at.sv.deltae.color.OutOfBounds if the color has no representation in the Lab ranges
     */
    LabValue toLab();

    /**
     * The (L*, a*, b*) components the color difference is calculated from. Unlike {@link #toLab()} these are not
     * range checked, so every valid color can be measured.
     */
    default Matrix3x1 labComponents() {
        return toLab().toMatrix();
    }

    /**
     * @param other  the sample; this color is the reference for the asymmetric {@link DEMethod.Cmc}
     * @param method how to measure the difference
     */
    default DeltaE delta(Delta other, DEMethod method) {
        return DeltaE.between(this, other, method);
    }
}
