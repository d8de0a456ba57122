package org.neuralchilli.rasterindex.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Results of a calculation run, one entry per requested (raster, index) pair.
 */
public record CalculationReport(
        @JsonProperty("results") List<TaskResult> results,
        @JsonProperty("total_time") double totalTime
) {
    public CalculationReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public long count(CalculationStatus status) {
        return results.stream()
                .filter(result -> result.calculationStatus() == status)
                .count();
    }

    public long savedCount() {
        return results.stream()
                .filter(TaskResult::isSaved)
                .count();
    }
}
