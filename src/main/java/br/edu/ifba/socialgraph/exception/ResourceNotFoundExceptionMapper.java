package br.edu.ifba.socialgraph.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class ResourceNotFoundExceptionMapper implements ExceptionMapper<ResourceNotFoundException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final ResourceNotFoundException exception) {
        return ErrorResponse.toResponse(Response.Status.NOT_FOUND, exception.getMessage(), uriInfo.getPath());
    }
}
