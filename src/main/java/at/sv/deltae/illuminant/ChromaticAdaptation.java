package at.sv.deltae.illuminant;

import at.sv.deltae.color.XyzValue;
import at.sv.deltae.matrix.Matrix3x1;
import at.sv.deltae.matrix.Matrix3x3;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves an XYZ value from the white point of its illuminant to the white point of another one:
 * <pre>
 * adapted = M⁻¹ · diag(ρd/ρs, γd/γs, βd/βs) · M · xyz
 * </pre>
 * where {@code (ρ, γ, β)} are the cone responses {@code M · whitePoint} of source and destination.
 */
@Slf4j
public final class ChromaticAdaptation {

    private ChromaticAdaptation() {
    }

    /**
     * Adapts the given value to the destination illuminant. If the value already is relative to an equal white point
     * it is returned as is.
     *
     * @throws IllegalArgumentException if either white point, or its cone response, has a zero component
     */
    public static XyzValue adapt(XyzValue xyz, Illuminant destination, ChromaticAdaptationMethod method) {
        Illuminant source = xyz.illuminant();
        if (source.equals(destination)) {
            log.trace("Skip adaptation of {}: already relative to {}", xyz, destination);
            return xyz;
        }
        Matrix3x1 adapted = adaptationMatrix(source, destination, method).multiply(xyz.toMatrix());
        log.trace("Adapted {} from {} to {} using {}", xyz, source, destination, method);
        return XyzValue.of(adapted, destination);
    }

    /**
     * @return the combined linear transform from source to destination white point
     * @throws IllegalArgumentException if either white point, or its cone response, has a zero component
     */
    public static Matrix3x3 adaptationMatrix(Illuminant source, Illuminant destination, ChromaticAdaptationMethod method) {
        assertNonZero(source);
        assertNonZero(destination);
        Matrix3x1 sourceResponse = source.coneResponse(method);
        Matrix3x1 destinationResponse = destination.coneResponse(method);
        if (sourceResponse.hasZeroComponent()) {
            throw new IllegalArgumentException("Illuminant " + source + " has a zero cone response " + sourceResponse
                                               + " for " + method + " and can't be adapted from");
        }
        Matrix3x3 scale = Matrix3x3.diagonal(new Matrix3x1(
                destinationResponse.x() / sourceResponse.x(),
                destinationResponse.y() / sourceResponse.y(),
                destinationResponse.z() / sourceResponse.z()));
        return method.getInverseConeResponseMatrix()
                     .multiply(scale)
                     .multiply(method.getConeResponseMatrix());
    }

    private static void assertNonZero(Illuminant illuminant) {
        if (illuminant.getWhitePoint().hasZeroComponent()) {
            throw new IllegalArgumentException("Illuminant " + illuminant
                                               + " has a zero tristimulus component and is not supported for chromatic adaptation");
        }
    }
}
