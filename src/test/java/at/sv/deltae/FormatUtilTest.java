package at.sv.deltae;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatUtilTest {

    @Test
    void formatNumber_shortest() {
        assertThat(FormatUtil.formatNumber(1.0)).isEqualTo("1");
        assertThat(FormatUtil.formatNumber(100.0)).isEqualTo("100");
        assertThat(FormatUtil.formatNumber(-6.96)).isEqualTo("-6.96");
        assertThat(FormatUtil.formatNumber(0.0001)).isEqualTo("0.0001");
        assertThat(FormatUtil.formatNumber(Double.NaN)).isEqualTo("NaN");
    }

    @Test
    void formatNumber_precision() {
        assertThat(FormatUtil.formatNumber(5.316938, 4)).isEqualTo("5.3169");
        assertThat(FormatUtil.formatNumber(2.0, 0)).isEqualTo("2");
        assertThat(FormatUtil.formatNumber(-0.5, 2)).isEqualTo("-0.50");
        assertThatThrownBy(() -> FormatUtil.formatNumber(1.0, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void roundTo_halfUp() {
        assertThat(FormatUtil.roundTo(2.345, 2)).isEqualTo(2.35);
        assertThat(FormatUtil.roundTo(-2.345, 2)).isEqualTo(-2.35);
        assertThat(FormatUtil.roundTo(7.0, 0)).isEqualTo(7.0);
    }
}
