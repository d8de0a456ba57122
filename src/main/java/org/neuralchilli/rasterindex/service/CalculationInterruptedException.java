package org.neuralchilli.rasterindex.service;

/**
 * Thrown when the thread running a calculation is interrupted before all results are in.
 */
public class CalculationInterruptedException extends RuntimeException {

    public CalculationInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
