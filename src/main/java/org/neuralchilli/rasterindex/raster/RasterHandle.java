package org.neuralchilli.rasterindex.raster;

/**
 * A loaded, validated raster. Pixel access is left to the implementations
 * of {@link BandStatisticsProvider} and {@link PixelEvaluator} that understand it.
 */
public interface RasterHandle {

    /**
     * Path or URI the raster was loaded from.
     */
    String source();

    /**
     * Base name of the source without directory or extension, used to name outputs.
     */
    String name();

    int width();

    int height();

    int bandCount();

    /**
     * Size in bytes of one sample of the first band.
     */
    int bytesPerPixel();

    /**
     * Size of the whole raster held in memory, in megabytes.
     */
    default double sizeInMegabytes() {
        double bytes = (double) width() * height() * bandCount() * bytesPerPixel();
        return bytes / 1024 / 1024;
    }
}
