package at.sv.deltae.color;

/**
 * A constructed value lies outside the numeric range of its color space.
 */
public final class OutOfBounds extends InvalidColorValue {

    public OutOfBounds(Object value) {
        super("value is out of range: '" + value + "'");
    }
}
