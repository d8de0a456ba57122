package org.neuralchilli.rasterindex.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Parameters of one calculation run. Optional limits fall back to configuration.
 */
public record CalculationRequest(
        @JsonProperty("inputs") List<String> inputs,
        @JsonProperty("indices") String indices,
        @JsonProperty("band_mapping") Map<String, Integer> bandMapping,
        @JsonProperty("output_dir") String outputDir,
        @JsonProperty("max_memory_usage") Double maxMemoryUsage,
        @JsonProperty("max_active_tasks") Integer maxActiveTasks
) {
    public CalculationRequest {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        bandMapping = bandMapping != null ? Map.copyOf(bandMapping) : Map.of();
    }

    /**
     * Index names from the comma-separated selection, trimmed, without empty or repeated entries.
     */
    @JsonIgnore
    public List<String> selectedIndices() {
        if (indices == null || indices.isBlank()) {
            return List.of();
        }
        return Arrays.stream(indices.split(","))
                .map(String::strip)
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();
    }
}
