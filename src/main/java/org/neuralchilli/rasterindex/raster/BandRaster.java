package org.neuralchilli.rasterindex.raster;

/**
 * Raster held fully in memory, one float array per band in row-major order.
 */
public final class BandRaster implements RasterHandle {

    private final String source;
    private final String name;
    private final int width;
    private final int height;
    private final int bytesPerPixel;
    private final float[][] bands;

    public BandRaster(String source, String name, int width, int height, int bytesPerPixel, float[][] bands) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Raster dimensions must be positive, got: " + width + "x" + height);
        }
        if (bands == null || bands.length == 0) {
            throw new IllegalArgumentException("Raster must have at least one band");
        }
        for (float[] band : bands) {
            if (band == null || band.length != width * height) {
                throw new IllegalArgumentException("Every band must hold width * height samples");
            }
        }
        this.source = source;
        this.name = name;
        this.width = width;
        this.height = height;
        this.bytesPerPixel = bytesPerPixel;
        this.bands = bands;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int bandCount() {
        return bands.length;
    }

    @Override
    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    /**
     * Samples of a band.
     *
     * @param band 1-based band number
     */
    public float[] band(int band) {
        if (band < 1 || band > bands.length) {
            throw new IllegalArgumentException(
                    "Band " + band + " out of range 1.." + bands.length + " for raster " + name);
        }
        return bands[band - 1];
    }

    public int pixelCount() {
        return width * height;
    }

    @Override
    public String toString() {
        return String.format("BandRaster[%s, %dx%d, %d bands]", name, width, height, bands.length);
    }
}
