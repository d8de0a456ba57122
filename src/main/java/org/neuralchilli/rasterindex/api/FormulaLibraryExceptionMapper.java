package org.neuralchilli.rasterindex.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.neuralchilli.rasterindex.core.FormulaLibraryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Provider
public class FormulaLibraryExceptionMapper implements ExceptionMapper<FormulaLibraryException> {

    private static final Logger log = LoggerFactory.getLogger(FormulaLibraryExceptionMapper.class);

    @Override
    public Response toResponse(FormulaLibraryException exception) {
        log.error("Formula library error", exception);
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse("formula_library", exception.getMessage()))
                .build();
    }
}
