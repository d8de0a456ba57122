package org.neuralchilli.rasterindex.service;

/**
 * Thrown when a calculation request cannot be run at all.
 * Aborts the whole run before any task is scheduled.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
