package org.neuralchilli.rasterindex.raster;

import org.neuralchilli.rasterindex.service.InvalidRasterException;

import java.nio.file.Path;

/**
 * Loads and validates a raster from storage.
 */
public interface RasterLoader {

    /**
     * @throws InvalidRasterException if the file is missing or not a readable raster
     */
    RasterHandle load(Path path);
}
