package org.neuralchilli.rasterindex.domain;

/**
 * A successfully computed task waiting for its staged output to be persisted.
 */
public record SaveRequest(CalculationTask task, TaskResult result) {

    public SaveRequest {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        if (result == null || !result.isSuccess()) {
            throw new IllegalArgumentException("Only successful results can be saved");
        }
    }
}
