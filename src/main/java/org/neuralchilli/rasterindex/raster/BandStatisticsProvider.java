package org.neuralchilli.rasterindex.raster;

import org.neuralchilli.rasterindex.domain.BandStatistic;

/**
 * Computes raw pixel statistics for a single band of a raster.
 */
public interface BandStatisticsProvider {

    /**
     * @param raster raster to inspect
     * @param band   1-based band number
     * @param kind   statistic to compute
     */
    double statistic(RasterHandle raster, int band, BandStatistic kind);
}
