package org.neuralchilli.rasterindex.raster;

/**
 * Thrown when a staged artifact cannot be converted to its final format.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
