package org.neuralchilli.rasterindex.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of evaluating one index over one raster.
 */
public enum CalculationStatus {
    /**
     * Pixel evaluation completed and the output is staged
     */
    SUCCESS("success"),

    /**
     * Task rejected, unresolvable, or the evaluator reported a failure
     */
    ERROR("error"),

    /**
     * Unexpected exception raised while evaluating
     */
    EXCEPTION("exception");

    private final String label;

    CalculationStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
