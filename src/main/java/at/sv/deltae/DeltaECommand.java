package at.sv.deltae;

import at.sv.deltae.color.LabValue;
import at.sv.deltae.color.LchValue;
import at.sv.deltae.color.RgbSystem;
import at.sv.deltae.color.RgbValue;
import at.sv.deltae.color.XyzValue;
import at.sv.deltae.illuminant.Illuminant;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Prints the color difference between two colors, e.g.:
 * <pre>
 * deltae -m de2000 -p 4 "89.73, 1.88, -6.96" "95.08, -0.17, -10.81"
 * 5.3169 DE2000
 * </pre>
 */
@Slf4j
@Command(name = "deltae", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Calculates the color difference (Delta E) between two colors.")
public final class DeltaECommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "COLOR0",
            description = "The reference color as three comma separated components, e.g. '89.73, 1.88, -6.96'.")
    String reference;

    @Parameters(index = "1", paramLabel = "COLOR1",
            description = "The sample color, in the same format as the reference.")
    String sample;

    @Option(names = {"-m", "--method"}, paramLabel = "<method>",
            defaultValue = "${env:DELTAE_METHOD:-de2000}",
            description = "The Delta E method: de2000, de1976, de1994, de1994t, decmc1 or decmc2, or one of their " +
                          "aliases (e.g. 00, 76, 94, 94t, cmc, cmc2). Default: ${DEFAULT-VALUE}")
    String method;

    @Option(names = {"-t", "--color-type"}, paramLabel = "<type>",
            defaultValue = "${env:DELTAE_COLOR_TYPE:-lab}",
            description = "How to read the colors: lab, lch, xyz or rgb. Default: ${DEFAULT-VALUE}")
    String colorType;

    @Option(names = {"-i", "--illuminant"}, paramLabel = "<illuminant>",
            defaultValue = "${env:DELTAE_ILLUMINANT:-D50}",
            description = "The reference white of xyz colors, e.g. D50, D65, A. Default: ${DEFAULT-VALUE}")
    String illuminant;

    @Option(names = {"-s", "--rgb-system"}, paramLabel = "<system>",
            defaultValue = "${env:DELTAE_RGB_SYSTEM:-SRGB}",
            description = "The RGB working space of rgb colors, e.g. SRGB, ADOBE_1998, PRO_PHOTO. Default: ${DEFAULT-VALUE}")
    String rgbSystem;

    @Option(names = {"-p", "--precision"}, paramLabel = "<digits>",
            description = "The number of decimal places to print. If omitted, the shortest exact representation is used.")
    Integer precision;

    public static void main(String[] args) {
        int execute = new CommandLine(new DeltaECommand()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        DEMethod deMethod = orUsageError(() -> DEMethod.parse(method));
        ColorType type = orUsageError(() -> ColorType.parse(colorType));
        Delta color0 = orUsageError(() -> parseColor(type, reference));
        Delta color1 = orUsageError(() -> parseColor(type, sample));
        if (precision != null && precision < 0) {
            fail("Precision must be >= 0, got " + precision);
        }
        log.debug("Comparing {} {} with {} using {}", type, reference, sample, deMethod);
        DeltaE deltaE = orUsageError(() -> color0.delta(color1, deMethod));
        spec.commandLine().getOut().println(precision == null ? deltaE.toString() : deltaE.format(precision));
    }

    private Delta parseColor(ColorType type, String text) {
        switch (type) {
            case LAB:
                return LabValue.parse(text);
            case LCH:
                return LchValue.parse(text);
            case XYZ:
                return XyzValue.parse(text, Illuminant.parse(illuminant));
            case RGB:
                RgbSystem system = parseRgbSystem(rgbSystem);
                return RgbValue.parse(text).toXyz(system);
            default:
                throw new IllegalStateException("Unhandled color type " + type);
        }
    }

    private static RgbSystem parseRgbSystem(String value) {
        try {
            return RgbSystem.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown RGB system '" + value + "'. Supported values: "
                                               + Arrays.toString(RgbSystem.values()), e);
        }
    }

    private <T> T orUsageError(Supplier<T> action) {
        try {
            return action.get();
        } catch (IllegalArgumentException e) {
            log.debug("Rejected input", e);
            fail(e.getMessage());
            return null;
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    enum ColorType {
        LAB, LCH, XYZ, RGB;

        static ColorType parse(String value) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "lab":
                    return LAB;
                case "lch":
                    return LCH;
                case "xyz":
                    return XYZ;
                case "rgb":
                    return RGB;
                default:
                    throw new IllegalArgumentException("Unknown color type '" + value + "'. Supported values: [lab, lch, xyz, rgb]");
            }
        }
    }
}
