package at.sv.deltae.color;

import at.sv.deltae.illuminant.Illuminant;
import at.sv.deltae.matrix.Matrix3x1;
import at.sv.deltae.matrix.Matrix3x3;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static at.sv.deltae.color.RgbMatrices.*;

/**
 * Reference RGB working spaces. Each fixes its RGB to XYZ matrix, the inverse XYZ to RGB matrix, the illuminant its
 * XYZ values are relative to and its companding curve.
 */
@Getter
@RequiredArgsConstructor
public enum RgbSystem {
    ADOBE_1998(ADOBERGB_1998_D65_RGB2XYZ, ADOBERGB_1998_D65_XYZ2RGB, Illuminant.D65, Companding.LINEAR),
    APPLE(APPLERGB_D65_RGB2XYZ, APPLERGB_D65_XYZ2RGB, Illuminant.D65, Companding.LINEAR),
    /**
     * Like Don RGB 4 with a modified red coordinate
     */
    BEST(BESTRGB_D50_RGB2XYZ, BESTRGB_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    BETA(BETARGB_D50_RGB2XYZ, BETARGB_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    /**
     * A compromise between ColorMatch and Adobe RGB
     */
    BRUCE(BRUCERGB_D65_RGB2XYZ, BRUCERGB_D65_XYZ2RGB, Illuminant.D65, Companding.LINEAR),
    CIE(CIERGB_E_RGB2XYZ, CIERGB_E_XYZ2RGB, Illuminant.E, Companding.LINEAR),
    COLOR_MATCH(COLORMATCHRGB_D50_RGB2XYZ, COLORMATCHRGB_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    DON_4(DONRGB4_D50_RGB2XYZ, DONRGB4_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    ECI(ECIRGB_D50_RGB2XYZ, ECIRGB_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    EKTA_SPACE_PS5(EKTASPACE_PS5_D50_RGB2XYZ, EKTASPACE_PS5_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    NTSC(NTSCRGB_C_RGB2XYZ, NTSCRGB_C_XYZ2RGB, Illuminant.C, Companding.LINEAR),
    PAL_SECAM(PALSECAMRGB_D65_RGB2XYZ, PALSECAMRGB_D65_XYZ2RGB, Illuminant.D65, Companding.LINEAR),
    /**
     * Also known as ROMM RGB
     */
    PRO_PHOTO(PROPHOTORGB_D50_RGB2XYZ, PROPHOTORGB_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR),
    SMPTE_C(SMPTERGB_D65_RGB2XYZ, SMPTERGB_D65_XYZ2RGB, Illuminant.D65, Companding.LINEAR),
    SRGB(SRGB_D65_RGB2XYZ, SRGB_D65_XYZ2RGB, Illuminant.D65, Companding.SRGB),
    WIDE_GAMUT(WIDEGAMUTRGB_D50_RGB2XYZ, WIDEGAMUTRGB_D50_XYZ2RGB, Illuminant.D50, Companding.LINEAR);

    public static final RgbSystem DEFAULT = SRGB;

    private final Matrix3x3 rgbToXyz;
    private final Matrix3x3 xyzToRgb;
    private final Illuminant illuminant;
    private final Companding companding;

    public XyzValue red() {
        return XyzValue.of(rgbToXyz.column(0), illuminant);
    }

    public XyzValue green() {
        return XyzValue.of(rgbToXyz.column(1), illuminant);
    }

    public XyzValue blue() {
        return XyzValue.of(rgbToXyz.column(2), illuminant);
    }

    /**
     * @return the system's white, i.e. the sum of its primaries
     */
    public XyzValue white() {
        return XyzValue.of(rgbToXyz.multiply(new Matrix3x1(1.0, 1.0, 1.0)), illuminant);
    }
}
