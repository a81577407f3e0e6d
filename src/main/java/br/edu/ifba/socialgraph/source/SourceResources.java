package br.edu.ifba.socialgraph.source;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Resolves a reference against a live source without storing anything, so clients can
 * check a seed before starting a crawl.
 */
@Path("/api/v1/sources")
@Produces(MediaType.APPLICATION_JSON)
public class SourceResources {

    @Inject
    SourceAdapterRegistry adapterRegistry;

    @GET
    @Path("/{source}/resolve")
    public EntityRecord resolve(@PathParam("source") final String source,
                                @QueryParam("reference") final String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("reference is required");
        }
        return adapterRegistry.forSource(SourceType.fromValue(source)).resolveEntity(reference.trim());
    }
}
