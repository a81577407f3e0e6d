package br.edu.ifba.socialgraph.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Invalid query or crawl parameters, including malformed ids and unknown enum values.
 */
@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IllegalArgumentException exception) {
        return ErrorResponse.toResponse(Response.Status.BAD_REQUEST, exception.getMessage(), uriInfo.getPath());
    }
}
