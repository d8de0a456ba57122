package org.neuralchilli.rasterindex.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.TaskResult;
import org.neuralchilli.rasterindex.monitoring.CalculationMetrics;
import org.neuralchilli.rasterindex.raster.PixelEvaluator;
import org.neuralchilli.rasterindex.raster.PixelEvaluator.EvaluationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs one calculation task through the pixel evaluator and turns the outcome
 * into a {@link TaskResult}. Never throws: unexpected failures become
 * {@code exception} results.
 */
@ApplicationScoped
public class CalculationTaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(CalculationTaskExecutor.class);

    @Inject
    PixelEvaluator pixelEvaluator;

    @Inject
    CalculationMetrics metrics;

    public CalculationTaskExecutor() {
    }

    CalculationTaskExecutor(PixelEvaluator pixelEvaluator, CalculationMetrics metrics) {
        this.pixelEvaluator = pixelEvaluator;
        this.metrics = metrics;
    }

    /**
     * Execute a calculation task.
     *
     * @param task Task to evaluate
     * @return result with calculation status, message and time spent
     */
    public TaskResult execute(CalculationTask task) {
        log.debug("Starting calculation for index: {}", task.index());
        CalculationMetrics.Timer timer = metrics.startTimer(CalculationMetrics.CALCULATION);

        try {
            EvaluationOutcome outcome = pixelEvaluator.evaluate(
                    task.expression(),
                    task.raster(),
                    task.bandMapping(),
                    task.stagingPath()
            );
            double seconds = toSeconds(timer.stop());

            if (outcome.success()) {
                metrics.recordCalculationSucceeded();
                log.info("Successfully calculated index: {} for {} in {} seconds",
                        task.index(), task.raster().name(), String.format("%.2f", seconds));
                return TaskResult.success(task.source(), task.index(), seconds);
            }

            metrics.recordCalculationFailed();
            log.warn("Failed to calculate index: {} for {} - {}",
                    task.index(), task.raster().name(), outcome.message());
            return TaskResult.error(task.source(), task.index(), outcome.message(), seconds);

        } catch (Exception e) {
            double seconds = toSeconds(timer.stop());
            metrics.recordCalculationExcepted();
            log.error("Error calculating index {} for {}", task.index(), task.raster().name(), e);

            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            return TaskResult.exception(task.source(), task.index(), message, seconds);
        }
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
