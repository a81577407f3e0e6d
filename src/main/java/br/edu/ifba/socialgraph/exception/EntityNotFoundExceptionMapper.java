package br.edu.ifba.socialgraph.exception;

import br.edu.ifba.socialgraph.source.EntityNotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class EntityNotFoundExceptionMapper implements ExceptionMapper<EntityNotFoundException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final EntityNotFoundException exception) {
        return ErrorResponse.toResponse(Response.Status.NOT_FOUND, exception.getMessage(), uriInfo.getPath());
    }
}
