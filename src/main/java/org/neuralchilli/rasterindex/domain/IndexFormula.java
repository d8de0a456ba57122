package org.neuralchilli.rasterindex.domain;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A named spectral index and its macro template.
 */
public record IndexFormula(String name, String template) {

    private static final String INDEX_FUNCTION = "index";

    public IndexFormula {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Formula name cannot be null or empty");
        }
        if (!name.matches("^\\w+$")) {
            throw new IllegalArgumentException(
                    "Formula name must match pattern ^\\w+$, got: " + name);
        }
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Template for formula '" + name + "' cannot be null or empty");
        }
        template = template.strip();
    }

    /**
     * Names of other formulas referenced through {@code func_index(...)}.
     */
    public Set<String> referencedIndices() {
        Set<String> references = new LinkedHashSet<>();
        for (MacroCall call : MacroCall.scan(template)) {
            if (INDEX_FUNCTION.equals(call.functionName()) && call.firstArgument() != null) {
                references.add(call.firstArgument());
            }
        }
        return references;
    }

    public boolean isFlat() {
        return !MacroCall.containsMacros(template);
    }
}
