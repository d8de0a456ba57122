package org.neuralchilli.rasterindex.core;

/**
 * Thrown when a formula library definition is malformed: unreadable source,
 * dangling {@code func_index} references or reference cycles.
 * Raised at startup, never while a calculation runs.
 */
public class FormulaLibraryException extends RuntimeException {

    public FormulaLibraryException(String message) {
        super(message);
    }

    public FormulaLibraryException(String message, Throwable cause) {
        super(message, cause);
    }
}
