package org.neuralchilli.rasterindex.domain;

import org.neuralchilli.rasterindex.raster.RasterHandle;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Immutable descriptor of one (raster, index) computation.
 * Handed to the compute backend as-is; the outcome comes back as a {@link TaskResult}.
 */
public record CalculationTask(
        UUID id,
        String index,
        String expression,
        RasterHandle raster,
        BandMapping bandMapping,
        double estimatedMemoryMb,
        String stagingPath,
        Path outputFile
) {
    public CalculationTask {
        if (id == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        if (index == null || index.isBlank()) {
            throw new IllegalArgumentException("Index name cannot be null or empty");
        }
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression for '" + index + "' cannot be null or empty");
        }
        if (raster == null) {
            throw new IllegalArgumentException("Raster cannot be null");
        }
        if (bandMapping == null) {
            throw new IllegalArgumentException("Band mapping cannot be null");
        }
        if (estimatedMemoryMb < 0) {
            throw new IllegalArgumentException("Estimated memory must be >= 0");
        }
        if (stagingPath == null || stagingPath.isBlank()) {
            throw new IllegalArgumentException("Staging path cannot be null or empty");
        }
        if (outputFile == null) {
            throw new IllegalArgumentException("Output file cannot be null");
        }
    }

    /**
     * Create a task with a fresh ID
     */
    public static CalculationTask create(
            String index,
            String expression,
            RasterHandle raster,
            BandMapping bandMapping,
            double estimatedMemoryMb,
            String stagingPath,
            Path outputFile
    ) {
        return new CalculationTask(
                UUID.randomUUID(),
                index,
                expression,
                raster,
                bandMapping,
                estimatedMemoryMb,
                stagingPath,
                outputFile
        );
    }

    public String description() {
        return "Calculate " + index;
    }

    public String source() {
        return raster.source();
    }
}
