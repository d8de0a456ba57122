package org.neuralchilli.rasterindex.raster;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes staged outputs as single-band float32 TIFF files.
 * The staged artifact is unlinked once written.
 */
@ApplicationScoped
public class TiffStorageConverter implements StorageConverter {

    private static final Logger log = LoggerFactory.getLogger(TiffStorageConverter.class);

    static final String FORMAT = "tiff";

    @Inject
    StagingArea stagingArea;

    public TiffStorageConverter() {
    }

    TiffStorageConverter(StagingArea stagingArea) {
        this.stagingArea = stagingArea;
    }

    @Override
    public void convert(String stagingPath, Path outputFile) throws ConversionException {
        StagingArea.StagedRaster staged = stagingArea.get(stagingPath)
                .orElseThrow(() -> new ConversionException("No staged output at " + stagingPath));

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(toImage(staged), FORMAT, outputFile.toFile())) {
                throw new ConversionException("No " + FORMAT + " writer available for " + outputFile);
            }
        } catch (IOException e) {
            throw new ConversionException("Could not write " + outputFile + ": " + e.getMessage(), e);
        }

        stagingArea.remove(stagingPath);
        log.debug("Converted {} to {}", stagingPath, outputFile);
    }

    @Override
    public void release(String stagingPath) {
        stagingArea.remove(stagingPath);
    }

    private static BufferedImage toImage(StagingArea.StagedRaster staged) {
        ColorModel colorModel = new ComponentColorModel(
                ColorSpace.getInstance(ColorSpace.CS_GRAY),
                false,
                false,
                Transparency.OPAQUE,
                DataBuffer.TYPE_FLOAT
        );
        WritableRaster raster = colorModel.createCompatibleWritableRaster(staged.width(), staged.height());
        raster.setSamples(0, 0, staged.width(), staged.height(), 0, staged.data());
        return new BufferedImage(colorModel, raster, false, null);
    }
}
