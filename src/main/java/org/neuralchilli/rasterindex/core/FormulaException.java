package org.neuralchilli.rasterindex.core;

/**
 * Thrown when a formula template cannot be expanded into a flat band expression.
 */
public class FormulaException extends RuntimeException {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
