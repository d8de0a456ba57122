package org.neuralchilli.rasterindex.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Per-band statistics a formula template can reference through
 * {@code func_band_max(X)}, {@code func_band_min(X)}, {@code func_band_mean(X)}
 * and {@code func_band_stddev(X)}.
 */
public enum BandStatistic {
    MAX("band_max"),
    MIN("band_min"),
    MEAN("band_mean"),
    STDDEV("band_stddev");

    private final String functionName;

    BandStatistic(String functionName) {
        this.functionName = functionName;
    }

    /**
     * Macro function name without the {@code func_} prefix.
     */
    public String functionName() {
        return functionName;
    }

    public static Optional<BandStatistic> fromFunctionName(String name) {
        return Arrays.stream(values())
                .filter(stat -> stat.functionName.equals(name))
                .findFirst();
    }
}
