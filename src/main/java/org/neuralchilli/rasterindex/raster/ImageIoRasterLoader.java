package org.neuralchilli.rasterindex.raster;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.rasterindex.service.InvalidRasterException;
import org.neuralchilli.rasterindex.util.RasterPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads any raster ImageIO can decode (TIFF, PNG, ...) into a {@link BandRaster}.
 */
@ApplicationScoped
public class ImageIoRasterLoader implements RasterLoader {

    private static final Logger log = LoggerFactory.getLogger(ImageIoRasterLoader.class);

    @Override
    public RasterHandle load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new InvalidRasterException("Raster file not found: " + path);
        }

        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new InvalidRasterException("Could not read raster " + path + ": " + e.getMessage(), e);
        }

        if (image == null) {
            throw new InvalidRasterException("Not a readable raster: " + path);
        }

        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bandCount = raster.getNumBands();

        float[][] bands = new float[bandCount][];
        for (int b = 0; b < bandCount; b++) {
            bands[b] = raster.getSamples(0, 0, width, height, b, (float[]) null);
        }

        int bytesPerPixel = bytesPerSample(raster);

        BandRaster loaded = new BandRaster(
                path.toString(),
                RasterPaths.baseName(path),
                width,
                height,
                bytesPerPixel,
                bands
        );

        log.debug("Loaded {} from {} ({} MB)", loaded, path, String.format("%.3f", loaded.sizeInMegabytes()));
        return loaded;
    }

    /**
     * Bytes of one sample of the first band. Packed layouts count their bits per
     * band, not the width of the storage word.
     */
    static int bytesPerSample(Raster raster) {
        int bits = raster.getSampleModel().getSampleSize(0);
        return Math.max(1, (bits + 7) / 8);
    }
}
