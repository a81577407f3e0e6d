package br.edu.ifba.socialgraph.exception;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.storage.GraphStoreException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class GraphStoreExceptionMapper implements ExceptionMapper<GraphStoreException> {

    private static final Logger LOG = Logger.getLogger(GraphStoreExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final GraphStoreException exception) {
        LOG.errorf(exception, "Graph store failure");
        return ErrorResponse.toResponse(Response.Status.INTERNAL_SERVER_ERROR,
            "Graph store failure", uriInfo.getPath());
    }
}
