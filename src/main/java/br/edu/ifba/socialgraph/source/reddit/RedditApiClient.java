package br.edu.ifba.socialgraph.source.reddit;

import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import com.fasterxml.jackson.databind.JsonNode;

import br.edu.ifba.socialgraph.source.SourceResponseExceptionMapper;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * REST client for Reddit's public JSON listings.
 *
 * <pre>
 * quarkus.rest-client.reddit-api.url=https://www.reddit.com
 * </pre>
 *
 * Reddit rejects requests without a descriptive User-Agent.
 */
@RegisterRestClient(configKey = "reddit-api")
@RegisterProvider(SourceResponseExceptionMapper.class)
@Produces(MediaType.APPLICATION_JSON)
public interface RedditApiClient {

    @GET
    @Path("/r/{name}/about.json")
    JsonNode getCommunity(@PathParam("name") String name,
                          @HeaderParam("User-Agent") String userAgent);

    /**
     * @param timeframe one of hour, day, week, month, year, all
     */
    @GET
    @Path("/r/{name}/top.json")
    JsonNode getTopPosts(@PathParam("name") String name,
                         @QueryParam("limit") int limit,
                         @QueryParam("t") String timeframe,
                         @HeaderParam("User-Agent") String userAgent);

    @GET
    @Path("/user/{name}/about.json")
    JsonNode getUser(@PathParam("name") String name,
                     @HeaderParam("User-Agent") String userAgent);

    @GET
    @Path("/user/{name}/submitted.json")
    JsonNode getSubmittedPosts(@PathParam("name") String name,
                               @QueryParam("limit") int limit,
                               @HeaderParam("User-Agent") String userAgent);
}
