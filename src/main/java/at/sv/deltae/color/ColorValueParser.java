package at.sv.deltae.color;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits comma separated text ({@code "92.5, 33.5, -18.8"}) into its numeric fields. Whitespace around the fields and
 * empty fields are ignored.
 */
final class ColorValueParser {

    private static final int FIELDS = 3;

    private ColorValueParser() {
    }

    /**
     * @throws BadFormat if the text doesn't consist of exactly three decimal numbers
     */
    static double[] parseDecimals(String text) {
        List<String> fields = split(text);
        double[] values = new double[FIELDS];
        for (int i = 0; i < FIELDS; i++) {
            try {
                values[i] = Double.parseDouble(fields.get(i));
            } catch (NumberFormatException e) {
                throw new BadFormat(text, e);
            }
        }
        return values;
    }

    /**
     * @throws BadFormat if the text doesn't consist of exactly three integers
     */
    static int[] parseIntegers(String text) {
        List<String> fields = split(text);
        int[] values = new int[FIELDS];
        for (int i = 0; i < FIELDS; i++) {
            try {
                values[i] = Integer.parseInt(fields.get(i));
            } catch (NumberFormatException e) {
                throw new BadFormat(text, e);
            }
        }
        return values;
    }

    private static List<String> split(String text) {
        if (text == null) {
            throw new BadFormat(null);
        }
        List<String> fields = new ArrayList<>(FIELDS);
        for (String field : text.split(",")) {
            String trimmed = field.trim();
            if (!trimmed.isEmpty()) {
                fields.add(trimmed);
            }
        }
        if (fields.size() != FIELDS) {
            throw new BadFormat(text);
        }
        return fields;
    }
}
