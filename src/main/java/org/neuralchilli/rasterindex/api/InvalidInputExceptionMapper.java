package org.neuralchilli.rasterindex.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.neuralchilli.rasterindex.service.InvalidInputException;
import org.neuralchilli.rasterindex.service.UnsupportedIndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invalid requests, unsupported indices and unreadable rasters answer 400.
 */
@Provider
public class InvalidInputExceptionMapper implements ExceptionMapper<InvalidInputException> {

    private static final Logger log = LoggerFactory.getLogger(InvalidInputExceptionMapper.class);

    @Override
    public Response toResponse(InvalidInputException exception) {
        log.warn("Rejected calculation request: {}", exception.getMessage());

        String error = exception instanceof UnsupportedIndexException ? "unsupported_index" : "invalid_input";
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(error, exception.getMessage()))
                .build();
    }
}
