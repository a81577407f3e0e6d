package br.edu.ifba.socialgraph.crawl;

import java.net.URI;
import java.time.Duration;
import java.util.UUID;

import br.edu.ifba.socialgraph.core.CrawlJob;
import br.edu.ifba.socialgraph.core.CrawlStatus;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.shared.UuidUtils;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/api/v1/crawl/jobs")
@Produces(MediaType.APPLICATION_JSON)
public class CrawlResources {

    static final int MAX_WAIT_SECONDS = 60;

    @Inject
    CrawlEngine crawlEngine;

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response start(@Valid @NotNull final CrawlRequest request) {
        final CrawlJob job = crawlEngine.startCrawl(
                request.source(),
                request.startEntity(),
                request.depthOrDefault(),
                request.maxEntitiesOrDefault());
        return Response.accepted(job)
                .location(URI.create("/api/v1/crawl/jobs/" + job.id()))
                .build();
    }

    @GET
    public CrawlJobPage list(@QueryParam("source") final String source,
                             @QueryParam("status") final String status,
                             @QueryParam("page") @DefaultValue("1") final int page,
                             @QueryParam("page_size") @DefaultValue("20") final int pageSize) {
        return crawlEngine.listCrawlJobs(
                source != null ? SourceType.fromValue(source) : null,
                status != null ? CrawlStatus.fromValue(status) : null,
                page,
                pageSize);
    }

    /**
     * Returns the job snapshot. With {@code wait} set, blocks up to that many seconds for
     * the job to finish first.
     */
    @GET
    @Path("/{id}")
    public CrawlJob get(@PathParam("id") final String id,
                        @QueryParam("wait") @DefaultValue("0") final int waitSeconds) {
        final UUID jobId = UuidUtils.parse(id, "id");
        if (waitSeconds < 0 || waitSeconds > MAX_WAIT_SECONDS) {
            throw new IllegalArgumentException("wait must be between 0 and " + MAX_WAIT_SECONDS + " seconds");
        }
        if (waitSeconds == 0) {
            return crawlEngine.getCrawlJob(jobId);
        }
        return crawlEngine.awaitCrawlJob(jobId, Duration.ofSeconds(waitSeconds));
    }

    @DELETE
    @Path("/{id}")
    public CrawlJob cancel(@PathParam("id") final String id) {
        return crawlEngine.cancelCrawl(UuidUtils.parse(id, "id"));
    }
}
