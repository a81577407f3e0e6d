package br.edu.ifba.socialgraph.exception;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.source.SourceUnavailableException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class SourceUnavailableExceptionMapper implements ExceptionMapper<SourceUnavailableException> {

    private static final Logger LOG = Logger.getLogger(SourceUnavailableExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final SourceUnavailableException exception) {
        LOG.errorf(exception, "Source %s unavailable", exception.getSource().getValue());
        return ErrorResponse.toResponse(Response.Status.BAD_GATEWAY, exception.getMessage(), uriInfo.getPath());
    }
}
