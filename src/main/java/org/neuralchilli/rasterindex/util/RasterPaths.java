package org.neuralchilli.rasterindex.util;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Naming of staged and final calculation outputs.
 */
public final class RasterPaths {

    public static final String STAGING_SCHEME = "mem://";
    public static final String OUTPUT_EXTENSION = ".tiff";

    private RasterPaths() {
    }

    /**
     * File name without directory and without its last extension.
     * Example: "/data/field_01.tif" -> "field_01"
     */
    public static String baseName(Path path) {
        if (path == null || path.getFileName() == null) {
            throw new IllegalArgumentException("Path has no file name: " + path);
        }

        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * In-memory location of a staged output, e.g. "mem://field_01_Rnorm_<task id>.tiff".
     * The task id keeps staged outputs of concurrent runs on same-named rasters apart.
     */
    public static String stagingPath(String rasterName, String index, UUID taskId) {
        return STAGING_SCHEME + rasterName + "_" + index + "_" + taskId + OUTPUT_EXTENSION;
    }

    public static Path outputPath(Path outputDir, String rasterName, String index) {
        return outputDir.resolve(outputName(rasterName, index));
    }

    private static String outputName(String rasterName, String index) {
        return rasterName + "_" + index + OUTPUT_EXTENSION;
    }
}
