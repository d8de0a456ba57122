package org.neuralchilli.rasterindex.raster;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.util.RasterPaths;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TiffStorageConverterTest {

    private final StagingArea stagingArea = new StagingArea();
    private final TiffStorageConverter converter = new TiffStorageConverter(stagingArea);

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteFloatTiffAndUnlinkStagedOutput() throws Exception {
        // Given: A staged 2x2 output with a negative value and a NaN
        String stagingPath = "mem://field_VARI_stary.tiff";
        stagingArea.put(stagingPath, new StagingArea.StagedRaster(2, 2, new float[]{0.5f, -1.25f, Float.NaN, 3f}));
        Path output = tempDir.resolve("nested").resolve("field_VARI_stary.tiff");

        // When: Convert
        converter.convert(stagingPath, output);

        // Then: The file holds the exact samples and the staged copy is gone
        BufferedImage image = ImageIO.read(output.toFile());
        assertThat(image).isNotNull();
        Raster raster = image.getRaster();
        assertThat(raster.getWidth()).isEqualTo(2);
        assertThat(raster.getHeight()).isEqualTo(2);
        assertThat(raster.getNumBands()).isEqualTo(1);
        assertThat(raster.getSampleFloat(0, 0, 0)).isEqualTo(0.5f);
        assertThat(raster.getSampleFloat(1, 0, 0)).isEqualTo(-1.25f);
        assertThat(raster.getSampleFloat(0, 1, 0)).isNaN();
        assertThat(raster.getSampleFloat(1, 1, 0)).isEqualTo(3f);
        assertThat(stagingArea.contains(stagingPath)).isFalse();
    }

    @Test
    void shouldKeepOutputsOfSameNamedRastersApart() throws Exception {
        // Given: Two rasters named "field" with different pixels, evaluated into one staging area
        JexlPixelEvaluator evaluator = new JexlPixelEvaluator(stagingArea);
        BandRaster first = new BandRaster("/data/2023/field.tif", "field", 1, 1, 1,
                new float[][]{{2}, {5}, {9}});
        BandRaster second = new BandRaster("/data/2024/field.tif", "field", 1, 1, 1,
                new float[][]{{7}, {5}, {9}});
        String firstStaging = RasterPaths.stagingPath("field", "Rnorm", UUID.randomUUID());
        String secondStaging = RasterPaths.stagingPath("field", "Rnorm", UUID.randomUUID());

        evaluator.evaluate("R / 2.0", first, BandMapping.rgb(), firstStaging);
        evaluator.evaluate("R / 2.0", second, BandMapping.rgb(), secondStaging);

        // When: Both are saved
        Path firstOutput = tempDir.resolve("a").resolve("field_Rnorm.tiff");
        Path secondOutput = tempDir.resolve("b").resolve("field_Rnorm.tiff");
        converter.convert(firstStaging, firstOutput);
        converter.convert(secondStaging, secondOutput);

        // Then: Each file holds its own raster's result
        assertThat(ImageIO.read(firstOutput.toFile()).getRaster().getSampleFloat(0, 0, 0)).isEqualTo(1f);
        assertThat(ImageIO.read(secondOutput.toFile()).getRaster().getSampleFloat(0, 0, 0)).isEqualTo(3.5f);
        assertThat(stagingArea.size()).isZero();
    }

    @Test
    void shouldFailWhenNothingIsStaged() {
        Path output = tempDir.resolve("field_Rnorm.tiff");

        assertThatThrownBy(() -> converter.convert("mem://field_Rnorm.tiff", output))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("No staged output at mem://field_Rnorm.tiff");
        assertThat(output).doesNotExist();
    }

    @Test
    void shouldReleaseStagedOutput() {
        stagingArea.put("mem://field_Rnorm.tiff", new StagingArea.StagedRaster(1, 1, new float[]{0.5f}));

        converter.release("mem://field_Rnorm.tiff");
        converter.release("mem://unknown.tiff");

        assertThat(stagingArea.contains("mem://field_Rnorm.tiff")).isFalse();
        assertThat(stagingArea.size()).isZero();
    }

    @Test
    void shouldRejectStagedDataOfWrongSize() {
        assertThatThrownBy(() -> new StagingArea.StagedRaster(2, 2, new float[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
