package org.neuralchilli.rasterindex.domain;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Outcome of persisting one staged artifact, handed back to the scheduler so it
 * can record the result and release {@code estimatedSizeMb} of reserved memory.
 */
public record SaveRecord(
        UUID taskId,
        double estimatedSizeMb,
        String description,
        Path outputFile,
        TaskResult result
) {
    public SaveRecord {
        if (taskId == null) {
            throw new IllegalArgumentException("Task ID cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null");
        }
    }

    public static SaveRecord of(SaveRequest request, TaskResult result) {
        CalculationTask task = request.task();
        return new SaveRecord(
                task.id(),
                task.estimatedMemoryMb(),
                task.description(),
                task.outputFile(),
                result
        );
    }
}
