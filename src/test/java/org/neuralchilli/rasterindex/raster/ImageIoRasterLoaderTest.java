package org.neuralchilli.rasterindex.raster;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.neuralchilli.rasterindex.service.InvalidRasterException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageIoRasterLoaderTest {

    private final ImageIoRasterLoader loader = new ImageIoRasterLoader();

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBandsInColorOrder() throws Exception {
        // Given: a 4x3 RGB image with a distinct first pixel
        BufferedImage image = new BufferedImage(4, 3, BufferedImage.TYPE_3BYTE_BGR);
        image.setRGB(0, 0, (200 << 16) | (100 << 8) | 50);
        Path file = tempDir.resolve("field.png");
        ImageIO.write(image, "png", file.toFile());

        // When: Load
        RasterHandle handle = loader.load(file);

        // Then: One band per color, red first
        assertThat(handle).isInstanceOf(BandRaster.class);
        BandRaster raster = (BandRaster) handle;
        assertThat(raster.name()).isEqualTo("field");
        assertThat(raster.source()).isEqualTo(file.toString());
        assertThat(raster.width()).isEqualTo(4);
        assertThat(raster.height()).isEqualTo(3);
        assertThat(raster.bandCount()).isEqualTo(3);
        assertThat(raster.bytesPerPixel()).isEqualTo(1);
        assertThat(raster.band(1)[0]).isEqualTo(200f);
        assertThat(raster.band(2)[0]).isEqualTo(100f);
        assertThat(raster.band(3)[0]).isEqualTo(50f);
        assertThat(raster.sizeInMegabytes()).isEqualTo(36.0 / 1024 / 1024);
    }

    @Test
    void shouldSizeSamplesByBitsPerBand() {
        // Packed RGB stores three 8-bit samples in one int
        assertThat(ImageIoRasterLoader.bytesPerSample(
                new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB).getRaster())).isEqualTo(1);
        assertThat(ImageIoRasterLoader.bytesPerSample(
                new BufferedImage(2, 2, BufferedImage.TYPE_USHORT_GRAY).getRaster())).isEqualTo(2);
        assertThat(ImageIoRasterLoader.bytesPerSample(
                new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_BINARY).getRaster())).isEqualTo(1);
    }

    @Test
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.tif")))
                .isInstanceOf(InvalidRasterException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void shouldRejectFileThatIsNotARaster() throws Exception {
        Path file = Files.writeString(tempDir.resolve("notes.tif"), "not a raster");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(InvalidRasterException.class);
    }
}
