package org.neuralchilli.rasterindex.worker;

import org.neuralchilli.rasterindex.domain.CalculationTask;
import org.neuralchilli.rasterindex.domain.TaskResult;

import java.util.concurrent.CompletableFuture;

/**
 * Executes calculation tasks asynchronously.
 *
 * The returned future completes with the task's result; per-task failures are
 * reported as {@code error} or {@code exception} results, not as exceptional completion.
 */
public interface ComputeBackend {

    CompletableFuture<TaskResult> submit(CalculationTask task);
}
