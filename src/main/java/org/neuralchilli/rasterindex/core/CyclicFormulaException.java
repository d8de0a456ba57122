package org.neuralchilli.rasterindex.core;

/**
 * Thrown when macro expansion does not reach a fixpoint within its round limit,
 * which happens when formulas reference each other in a cycle.
 */
public class CyclicFormulaException extends FormulaException {

    public CyclicFormulaException(String message) {
        super(message);
    }
}
