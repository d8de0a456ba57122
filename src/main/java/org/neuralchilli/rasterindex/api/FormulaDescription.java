package org.neuralchilli.rasterindex.api;

import java.util.List;

/**
 * A library formula with the formulas it expands through, dependencies first.
 */
public record FormulaDescription(String name, String template, List<String> dependencies) {
}
