package org.neuralchilli.rasterindex.raster;

import org.neuralchilli.rasterindex.domain.BandMapping;

/**
 * Evaluates a flat band expression pixel by pixel over a raster and stages
 * the single-band output under a staging path.
 */
public interface PixelEvaluator {

    /**
     * Evaluate over the full extent of the raster.
     *
     * @return outcome; implementations report evaluation problems here rather than throwing
     */
    EvaluationOutcome evaluate(String expression, RasterHandle raster, BandMapping bandMapping, String stagingPath);

    /**
     * Result of one pixel evaluation.
     */
    record EvaluationOutcome(boolean success, String message) {

        public static EvaluationOutcome succeeded() {
            return new EvaluationOutcome(true, null);
        }

        public static EvaluationOutcome failed(String message) {
            return new EvaluationOutcome(false, message);
        }
    }
}
