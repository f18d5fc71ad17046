package at.sv.deltae.color;

/**
 * Base of the recoverable errors raised for user supplied color values.
 */
public abstract class InvalidColorValue extends IllegalArgumentException {

    protected InvalidColorValue(String message) {
        super(message);
    }

    protected InvalidColorValue(String message, Throwable cause) {
        super(message, cause);
    }
}
