package org.neuralchilli.rasterindex.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.rasterindex.config.RasterIndexConfig;
import org.neuralchilli.rasterindex.core.IndexScheduler;
import org.neuralchilli.rasterindex.core.SchedulerSettings;
import org.neuralchilli.rasterindex.domain.BandMapping;
import org.neuralchilli.rasterindex.domain.CalculationReport;
import org.neuralchilli.rasterindex.domain.CalculationRequest;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.neuralchilli.rasterindex.monitoring.CalculationMetrics;
import org.neuralchilli.rasterindex.raster.RasterHandle;
import org.neuralchilli.rasterindex.raster.RasterLoader;
import org.neuralchilli.rasterindex.raster.StorageConverter;
import org.neuralchilli.rasterindex.worker.ComputeBackend;
import org.neuralchilli.rasterindex.worker.SaveWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of a calculation run.
 *
 * Validates the request, loads every raster up front, then schedules one task
 * per (raster, index) pair with its own save worker. Invalid input aborts the
 * run; every other failure is reported in the task's result.
 */
@ApplicationScoped
public class IndexCalculator {

    private static final Logger log = LoggerFactory.getLogger(IndexCalculator.class);

    @Inject
    CalculationRequestValidator validator;

    @Inject
    TaskPlanner planner;

    @Inject
    RasterLoader rasterLoader;

    @Inject
    ComputeBackend computeBackend;

    @Inject
    StorageConverter storageConverter;

    @Inject
    CalculationMetrics metrics;

    @Inject
    RasterIndexConfig config;

    /**
     * Run a calculation and wait for every result.
     *
     * @throws InvalidInputException           if the request or one of its rasters is invalid
     * @throws CalculationInterruptedException if the calling thread is interrupted
     */
    public CalculationReport execute(CalculationRequest request) {
        long start = System.nanoTime();
        CalculationMetrics.MetricsReport baseline = metrics.getReport();

        validator.validateRequest(request);
        BandMapping bandMapping = BandMapping.of(request.bandMapping());
        List<String> indices = request.selectedIndices();
        List<RasterHandle> rasters = loadRasters(request.inputs(), bandMapping);

        SchedulerSettings settings = settingsFor(request);
        Path outputDir = outputDirFor(request);
        int total = rasters.size() * indices.size();

        log.info("Calculating {} for {} rasters into {}", indices, rasters.size(), outputDir);

        SaveWorker saveWorker = new SaveWorker(storageConverter, metrics);
        saveWorker.start();

        List<TaskResult> results;
        try {
            IndexScheduler scheduler = new IndexScheduler(settings, computeBackend, saveWorker, metrics);
            results = scheduler.run(planner.plan(rasters, indices, bandMapping, outputDir), total);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CalculationInterruptedException("Calculation interrupted", e);
        } finally {
            saveWorker.stop(config.saveShutdownTimeout());
        }

        double totalTime = (System.nanoTime() - start) / 1_000_000_000.0;
        log.info("Calculation finished: {} results in {} seconds", results.size(), String.format("%.2f", totalTime));
        metrics.logReportSince(baseline);

        return new CalculationReport(results, totalTime);
    }

    private List<RasterHandle> loadRasters(List<String> inputs, BandMapping bandMapping) {
        List<RasterHandle> rasters = new ArrayList<>();
        for (String input : inputs) {
            RasterHandle raster = rasterLoader.load(Path.of(input));
            validator.validateRaster(raster, bandMapping);
            rasters.add(raster);
        }
        return rasters;
    }

    SchedulerSettings settingsFor(CalculationRequest request) {
        double budget = request.maxMemoryUsage() != null ? request.maxMemoryUsage() : config.memoryBudgetMb();
        int maxActive = request.maxActiveTasks() != null ? request.maxActiveTasks() : config.maxActiveTasks();
        return new SchedulerSettings(budget, maxActive, config.pollInterval(), config.backpressure());
    }

    private Path outputDirFor(CalculationRequest request) {
        String outputDir = request.outputDir() != null && !request.outputDir().isBlank()
                ? request.outputDir()
                : config.outputDir();
        return Path.of(outputDir);
    }
}
