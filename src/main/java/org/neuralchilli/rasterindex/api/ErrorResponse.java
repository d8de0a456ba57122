package org.neuralchilli.rasterindex.api;

public record ErrorResponse(String error, String message) {
}
