package org.neuralchilli.rasterindex.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.rasterindex.core.FormulaLibrary;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.CalculationRequest;
import org.neuralchilli.rasterindex.raster.RasterHandle;
import org.neuralchilli.rasterindex.util.RasterPaths;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates calculation requests before any raster is loaded or task scheduled.
 */
@ApplicationScoped
public class CalculationRequestValidator {

    @Inject
    FormulaLibrary library;

    public CalculationRequestValidator() {
    }

    CalculationRequestValidator(FormulaLibrary library) {
        this.library = library;
    }

    /**
     * Validate a request.
     *
     * @throws UnsupportedIndexException if a selected index is not in the library
     * @throws InvalidInputException     if any other parameter is invalid
     */
    public void validateRequest(CalculationRequest request) {
        if (request == null) {
            throw new InvalidInputException("Calculation request cannot be null");
        }

        // Unknown indices fail on their own, ahead of other problems
        for (String index : request.selectedIndices()) {
            if (!library.contains(index)) {
                throw new UnsupportedIndexException(index);
            }
        }

        List<String> errors = new ArrayList<>();

        validateInputs(request.inputs(), errors);

        if (request.selectedIndices().isEmpty()) {
            errors.add("At least one index must be selected");
        }

        validateBandMapping(request.bandMapping(), errors);

        if (request.maxMemoryUsage() != null && !(request.maxMemoryUsage() > 0)) {
            errors.add("max_memory_usage must be > 0, got: " + request.maxMemoryUsage());
        }
        if (request.maxActiveTasks() != null && request.maxActiveTasks() < 1) {
            errors.add("max_active_tasks must be >= 1, got: " + request.maxActiveTasks());
        }

        if (!errors.isEmpty()) {
            throw new InvalidInputException("Calculation request validation failed:\n" +
                    String.join("\n", errors));
        }
    }

    /**
     * Check that every mapped band exists in a loaded raster.
     *
     * @throws InvalidRasterException if the mapping points past the raster's bands
     */
    public void validateRaster(RasterHandle raster, BandMapping bandMapping) {
        List<String> errors = new ArrayList<>();
        bandMapping.bands().forEach((symbol, band) -> {
            if (band > raster.bandCount()) {
                errors.add("Band " + band + " mapped to '" + symbol + "' does not exist (" +
                        raster.bandCount() + " bands)");
            }
        });

        if (!errors.isEmpty()) {
            throw new InvalidRasterException("Invalid raster " + raster.source() + ":\n" +
                    String.join("\n", errors));
        }
    }

    private void validateInputs(List<String> inputs, List<String> errors) {
        if (inputs.isEmpty()) {
            errors.add("At least one input raster is required");
            return;
        }

        Set<String> baseNames = new HashSet<>();
        for (String input : inputs) {
            if (input == null || input.isBlank()) {
                errors.add("Input raster path cannot be empty");
                continue;
            }
            try {
                String baseName = RasterPaths.baseName(Path.of(input));
                if (!baseNames.add(baseName)) {
                    errors.add("Inputs share the base name '" + baseName + "', their outputs would collide");
                }
            } catch (IllegalArgumentException e) {
                errors.add("Invalid input path '" + input + "': " + e.getMessage());
            }
        }
    }

    private void validateBandMapping(Map<String, Integer> bandMapping, List<String> errors) {
        try {
            BandMapping.of(bandMapping);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
    }
}
