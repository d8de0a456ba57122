package org.neuralchilli.rasterindex.service;

/**
 * Thrown when an input raster is missing, unreadable or incompatible with the band mapping.
 */
public class InvalidRasterException extends InvalidInputException {

    public InvalidRasterException(String message) {
        super(message);
    }

    public InvalidRasterException(String message, Throwable cause) {
        super(message, cause);
    }
}
