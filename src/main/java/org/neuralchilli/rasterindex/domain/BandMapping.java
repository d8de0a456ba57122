package org.neuralchilli.rasterindex.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps symbolic band letters used in formulas (R, G, B, ...) to the
 * 1-based band numbers of a concrete raster.
 */
public record BandMapping(Map<String, Integer> bands) {

    public BandMapping {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("Band mapping cannot be null or empty");
        }
        for (Map.Entry<String, Integer> entry : bands.entrySet()) {
            if (entry.getKey() == null || !entry.getKey().matches("^[A-Za-z]\\w*$")) {
                throw new IllegalArgumentException(
                        "Band symbol must be an identifier, got: " + entry.getKey());
            }
            if (entry.getValue() == null || entry.getValue() < 1) {
                throw new IllegalArgumentException(
                        "Band number for '" + entry.getKey() + "' must be >= 1, got: " + entry.getValue());
            }
        }
        bands = Collections.unmodifiableMap(new LinkedHashMap<>(bands));
    }

    public static BandMapping of(Map<String, Integer> bands) {
        return new BandMapping(bands);
    }

    /**
     * Standard red/green/blue mapping onto bands 1, 2 and 3.
     */
    public static BandMapping rgb() {
        Map<String, Integer> bands = new LinkedHashMap<>();
        bands.put("R", 1);
        bands.put("G", 2);
        bands.put("B", 3);
        return new BandMapping(bands);
    }

    /**
     * Band number for a symbol, or null if the symbol is not mapped.
     */
    public Integer bandFor(String symbol) {
        return bands.get(symbol);
    }

    public boolean contains(String symbol) {
        return bands.containsKey(symbol);
    }

    public Set<String> symbols() {
        return bands.keySet();
    }

    public int highestBand() {
        return bands.values().stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0);
    }
}
