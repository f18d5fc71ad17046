package at.sv.deltae.color;

/**
 * Text could not be parsed into the expected number of numeric fields.
 */
public final class BadFormat extends InvalidColorValue {

    public BadFormat(String text) {
        super("value is malformed: '" + text + "'");
    }

    public BadFormat(String text, Throwable cause) {
        super("value is malformed: '" + text + "'", cause);
    }
}
