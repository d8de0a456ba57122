package org.neuralchilli.rasterindex.service;

/**
 * Thrown when a requested index name is not in the formula library.
 */
public class UnsupportedIndexException extends InvalidInputException {

    private final String index;

    public UnsupportedIndexException(String index) {
        super("Unsupported index: " + index);
        this.index = index;
    }

    public String index() {
        return index;
    }
}
