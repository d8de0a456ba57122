package org.neuralchilli.rasterindex.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Final outcome of one (raster, index) pair.
 * Created once by the compute backend (or by the scheduler for tasks that never ran);
 * the saving fields are filled in later for successful calculations only.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TaskResult(
        @JsonProperty("source") String source,
        @JsonProperty("index") String index,
        @JsonProperty("calculation_status") CalculationStatus calculationStatus,
        @JsonProperty("message") String message,
        @JsonProperty("output_file") String outputFile,
        @JsonProperty("time_spent") double timeSpent,
        @JsonProperty("saving_status") String savingStatus
) {
    public static final String SAVE_SUCCESS = "success";
    public static final String SAVE_ERROR_PREFIX = "error - ";

    public TaskResult {
        if (index == null || index.isBlank()) {
            throw new IllegalArgumentException("Index name cannot be null or empty");
        }
        if (calculationStatus == null) {
            throw new IllegalArgumentException("Calculation status cannot be null");
        }
        if (timeSpent < 0) {
            throw new IllegalArgumentException("Time spent must be >= 0");
        }
    }

    public static TaskResult success(String source, String index, double timeSpent) {
        return new TaskResult(source, index, CalculationStatus.SUCCESS, null, null, timeSpent, null);
    }

    public static TaskResult error(String source, String index, String message, double timeSpent) {
        return new TaskResult(source, index, CalculationStatus.ERROR, message, null, timeSpent, null);
    }

    public static TaskResult exception(String source, String index, String message, double timeSpent) {
        return new TaskResult(source, index, CalculationStatus.EXCEPTION, message, null, timeSpent, null);
    }

    /**
     * Result for a task whose memory estimate alone exceeds the budget.
     */
    public static TaskResult rejected(CalculationTask task) {
        return error(
                task.source(),
                task.index(),
                "Task " + task.description() + " exceeds the maximum memory usage",
                0
        );
    }

    /**
     * Mark as persisted to the final output file
     */
    public TaskResult withSaved(Path output) {
        return new TaskResult(
                source, index, calculationStatus, message,
                output != null ? output.toString() : null,
                timeSpent, SAVE_SUCCESS
        );
    }

    /**
     * Mark as failed to persist
     */
    public TaskResult withSaveFailure(String detail) {
        return new TaskResult(
                source, index, calculationStatus, message, null,
                timeSpent, SAVE_ERROR_PREFIX + detail
        );
    }

    public boolean isSuccess() {
        return calculationStatus.isSuccess();
    }

    public boolean isSaved() {
        return SAVE_SUCCESS.equals(savingStatus);
    }
}
