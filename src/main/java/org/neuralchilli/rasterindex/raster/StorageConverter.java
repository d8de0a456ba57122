package org.neuralchilli.rasterindex.raster;

import java.nio.file.Path;

/**
 * Persists staged artifacts to their final on-disk format.
 */
public interface StorageConverter {

    /**
     * Convert the artifact staged at {@code stagingPath} into {@code outputFile}.
     *
     * @throws ConversionException if the artifact is missing or cannot be written
     */
    void convert(String stagingPath, Path outputFile) throws ConversionException;

    /**
     * Discard a staged artifact. Unknown paths are ignored.
     */
    void release(String stagingPath);
}
