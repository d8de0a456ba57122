package org.neuralchilli.rasterindex.raster;

import org.junit.jupiter.api.Test;
import org.neuralchilli.rasterindex.domain.BandMapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RasterCalcTranslatorTest {

    private final BandMapping rgb = BandMapping.rgb();

    @Test
    void shouldParenthesizeByPrecedence() {
        RasterCalcTranslator.Translation translation = RasterCalcTranslator.translate("R / (R + G + B)", rgb);

        assertThat(translation.source()).isEqualTo("(v0 / (((v0 + v1) + v2)))");
        assertThat(translation.bandVariables()).containsEntry("R", "v0").containsEntry("G", "v1").containsEntry("B", "v2");
        assertThat(translation.constants()).isEmpty();
    }

    @Test
    void shouldTurnLiteralsIntoConstants() {
        RasterCalcTranslator.Translation translation = RasterCalcTranslator.translate("G - 0.39 * R - 0.61 * B", rgb);

        assertThat(translation.source()).isEqualTo("((v0 - (c0 * v1)) - (c1 * v2))");
        assertThat(translation.constants()).containsExactly(0.39, 0.61);
    }

    @Test
    void shouldTranslateCaretToPower() {
        RasterCalcTranslator.Translation translation = RasterCalcTranslator.translate("G^2 - R ^ 2", rgb);

        assertThat(translation.source()).isEqualTo("(math:pow(v0, c0) - math:pow(v1, c1))");
    }

    @Test
    void shouldBindPowerTighterThanUnaryMinus() {
        assertThat(RasterCalcTranslator.translate("-G^2", rgb).source()).isEqualTo("(-math:pow(v0, c0))");
    }

    @Test
    void shouldTreatPowerAsRightAssociative() {
        assertThat(RasterCalcTranslator.translate("2^3^2", rgb).source())
                .isEqualTo("math:pow(c0, math:pow(c1, c2))");
    }

    @Test
    void shouldAcceptNegativeLiteralsFromStatistics() {
        RasterCalcTranslator.Translation translation = RasterCalcTranslator.translate("R - (-3.5)", rgb);

        assertThat(translation.source()).isEqualTo("(v0 - ((-c0)))");
        assertThat(translation.constants()).containsExactly(3.5);
    }

    @Test
    void shouldRejectUnmappedBand() {
        assertThatThrownBy(() -> RasterCalcTranslator.translate("N / R", rgb))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown band symbol 'N'");
    }

    @Test
    void shouldRejectIncompleteExpressions() {
        assertThatThrownBy(() -> RasterCalcTranslator.translate("R +", rgb))
                .hasMessageContaining("Unexpected end of expression");
        assertThatThrownBy(() -> RasterCalcTranslator.translate("(R + G", rgb))
                .hasMessageContaining("Missing ')'");
        assertThatThrownBy(() -> RasterCalcTranslator.translate("R G", rgb))
                .hasMessageContaining("Unexpected 'G'");
        assertThatThrownBy(() -> RasterCalcTranslator.translate("R % G", rgb))
                .hasMessageContaining("Unexpected '%'");
    }
}
