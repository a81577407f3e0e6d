package br.edu.ifba.socialgraph.exception;

import br.edu.ifba.socialgraph.crawl.CrawlJobFinishedException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class CrawlJobFinishedExceptionMapper implements ExceptionMapper<CrawlJobFinishedException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final CrawlJobFinishedException exception) {
        return ErrorResponse.toResponse(Response.Status.CONFLICT, exception.getMessage(), uriInfo.getPath());
    }
}
