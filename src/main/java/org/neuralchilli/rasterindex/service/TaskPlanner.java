package org.neuralchilli.rasterindex.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.rasterindex.core.FormulaException;
import org.neuralchilli.rasterindex.core.FormulaResolver;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.TaskPlan;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.neuralchilli.rasterindex.raster.RasterHandle;
import org.neuralchilli.rasterindex.util.RasterPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Generates one task per (raster, index) pair, resolving each formula
 * against the raster as the scheduler asks for the next task.
 */
@ApplicationScoped
public class TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanner.class);

    @Inject
    FormulaResolver resolver;

    public TaskPlanner() {
    }

    TaskPlanner(FormulaResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Plans in raster-major order: every index for the first raster, then the next raster.
     */
    public Iterator<TaskPlan> plan(
            List<RasterHandle> rasters,
            List<String> indices,
            BandMapping bandMapping,
            Path outputDir
    ) {
        return rasters.stream()
                .flatMap(raster -> indices.stream()
                        .map(index -> planTask(raster, index, bandMapping, outputDir)))
                .iterator();
    }

    TaskPlan planTask(RasterHandle raster, String index, BandMapping bandMapping, Path outputDir) {
        log.debug("Creating task for index: {} on {}", index, raster.name());

        String expression;
        try {
            expression = resolver.resolveIndex(index, raster, bandMapping);
        } catch (FormulaException e) {
            log.warn("Could not resolve index {} for {}: {}", index, raster.name(), e.getMessage());
            return TaskPlan.unresolvable(TaskResult.error(
                    raster.source(), index, "Formula resolution failed: " + e.getMessage(), 0));
        }

        UUID id = UUID.randomUUID();
        return TaskPlan.ready(new CalculationTask(
                id,
                index,
                expression,
                raster,
                bandMapping,
                taskCost(raster),
                RasterPaths.stagingPath(raster.name(), index, id),
                RasterPaths.outputPath(outputDir, raster.name(), index)
        ));
    }

    /**
     * Estimated memory of one task in MB: the input raster plus one output band.
     */
    public static double taskCost(RasterHandle raster) {
        double rasterMb = raster.sizeInMegabytes();
        return rasterMb + rasterMb / raster.bandCount();
    }
}
