package br.edu.ifba.socialgraph.exception;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.ratelimit.RateLimitExceededException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class RateLimitExceededExceptionMapper implements ExceptionMapper<RateLimitExceededException> {

    private static final Logger LOG = Logger.getLogger(RateLimitExceededExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final RateLimitExceededException exception) {
        LOG.warnf("Rate limit exceeded for %s", exception.getSource().getValue());
        final Response response = ErrorResponse.toResponse(Response.Status.TOO_MANY_REQUESTS,
            exception.getMessage(), uriInfo.getPath());
        return Response.fromResponse(response)
                .header("Retry-After", Math.max(1, exception.getMaxWait().toSeconds()))
                .build();
    }
}
