package org.neuralchilli.rasterindex.raster;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.rasterindex.domain.BandStatistic;

/**
 * Exact statistics over every sample of a {@link BandRaster} band.
 * NaN samples are skipped; a band without valid samples yields NaN.
 * Standard deviation is the population deviation.
 */
@ApplicationScoped
public class InMemoryBandStatistics implements BandStatisticsProvider {

    @Override
    public double statistic(RasterHandle raster, int band, BandStatistic kind) {
        if (!(raster instanceof BandRaster bandRaster)) {
            throw new IllegalArgumentException("Unsupported raster handle: " + raster);
        }

        float[] samples = bandRaster.band(band);
        return switch (kind) {
            case MAX -> max(samples);
            case MIN -> min(samples);
            case MEAN -> mean(samples);
            case STDDEV -> stddev(samples);
        };
    }

    private static double max(float[] samples) {
        double max = Double.NaN;
        for (float sample : samples) {
            if (!Float.isNaN(sample) && (Double.isNaN(max) || sample > max)) {
                max = sample;
            }
        }
        return max;
    }

    private static double min(float[] samples) {
        double min = Double.NaN;
        for (float sample : samples) {
            if (!Float.isNaN(sample) && (Double.isNaN(min) || sample < min)) {
                min = sample;
            }
        }
        return min;
    }

    private static double mean(float[] samples) {
        double sum = 0;
        long count = 0;
        for (float sample : samples) {
            if (!Float.isNaN(sample)) {
                sum += sample;
                count++;
            }
        }
        return count > 0 ? sum / count : Double.NaN;
    }

    private static double stddev(float[] samples) {
        double mean = mean(samples);
        if (Double.isNaN(mean)) {
            return Double.NaN;
        }

        double squares = 0;
        long count = 0;
        for (float sample : samples) {
            if (!Float.isNaN(sample)) {
                double diff = sample - mean;
                squares += diff * diff;
                count++;
            }
        }
        return Math.sqrt(squares / count);
    }
}
