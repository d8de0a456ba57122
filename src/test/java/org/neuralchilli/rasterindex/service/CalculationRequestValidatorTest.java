package org.neuralchilli.rasterindex.service;

import org.junit.jupiter.api.Test;
import org.neuralchilli.rasterindex.core.FormulaLibrary;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.CalculationRequest;
import org.neuralchilli.rasterindex.support.FakeRaster;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalculationRequestValidatorTest {

    private static final Map<String, Integer> RGB = Map.of("R", 1, "G", 2, "B", 3);

    private final CalculationRequestValidator validator = new CalculationRequestValidator(FormulaLibrary.of(Map.of(
            "Rnorm", "R / func_band_max(R)",
            "ExG_wernette", "2 * G - R - B"
    )));

    @Test
    void shouldAcceptValidRequest() {
        CalculationRequest request = new CalculationRequest(
                List.of("/data/a.tif", "/data/b.tif"), "Rnorm, ExG_wernette", RGB, "/out", 512.0, 2);

        assertThatCode(() -> validator.validateRequest(request)).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectUnsupportedIndexFirst() {
        // Given: An unknown index alongside other problems
        CalculationRequest request = new CalculationRequest(List.of(), "Rnorm,NDVI", Map.of(), null, -1.0, 0);

        // When/Then: The unknown index is reported on its own
        assertThatThrownBy(() -> validator.validateRequest(request))
                .isInstanceOf(UnsupportedIndexException.class)
                .hasMessage("Unsupported index: NDVI")
                .satisfies(e -> assertThat(((UnsupportedIndexException) e).index()).isEqualTo("NDVI"));
    }

    @Test
    void shouldCollectEveryOtherProblem() {
        CalculationRequest request = new CalculationRequest(
                List.of(), " , ", Map.of("R", 0), null, 0.0, 0);

        assertThatThrownBy(() -> validator.validateRequest(request))
                .isInstanceOf(InvalidInputException.class)
                .isNotInstanceOf(UnsupportedIndexException.class)
                .hasMessageContaining("At least one input raster is required")
                .hasMessageContaining("At least one index must be selected")
                .hasMessageContaining("Band number for 'R' must be >= 1")
                .hasMessageContaining("max_memory_usage must be > 0")
                .hasMessageContaining("max_active_tasks must be >= 1");
    }

    @Test
    void shouldRejectInputsWithSameBaseName() {
        CalculationRequest request = new CalculationRequest(
                List.of("/data/2023/field.tif", "/data/2024/field.tif"), "Rnorm", RGB, null, null, null);

        assertThatThrownBy(() -> validator.validateRequest(request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Inputs share the base name 'field'");
    }

    @Test
    void shouldRejectBlankInputAndEmptyMapping() {
        CalculationRequest request = new CalculationRequest(List.of("  "), "Rnorm", null, null, null, null);

        assertThatThrownBy(() -> validator.validateRequest(request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Input raster path cannot be empty")
                .hasMessageContaining("Band mapping cannot be null or empty");
    }

    @Test
    void shouldRejectUnparsableInputPath() {
        CalculationRequest request = new CalculationRequest(
                List.of("/data/field\0.tif"), "Rnorm", RGB, null, null, null);

        assertThatThrownBy(() -> validator.validateRequest(request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Invalid input path");
    }

    @Test
    void shouldRejectNullRequest() {
        assertThatThrownBy(() -> validator.validateRequest(null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void shouldRejectRasterWithoutMappedBand() {
        // Given: A two band raster and a mapping onto band 3
        FakeRaster raster = FakeRaster.of("gray", 10, 10, 2);

        // When/Then
        assertThatThrownBy(() -> validator.validateRaster(raster, BandMapping.rgb()))
                .isInstanceOf(InvalidRasterException.class)
                .hasMessageContaining("Invalid raster /data/gray.tif")
                .hasMessageContaining("Band 3 mapped to 'B' does not exist (2 bands)");
    }

    @Test
    void shouldAcceptRasterWithMappedBands() {
        assertThatCode(() -> validator.validateRaster(FakeRaster.small("rgb"), BandMapping.rgb()))
                .doesNotThrowAnyException();
    }
}
