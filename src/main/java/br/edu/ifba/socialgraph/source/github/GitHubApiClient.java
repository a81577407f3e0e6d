package br.edu.ifba.socialgraph.source.github;

import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import com.fasterxml.jackson.databind.JsonNode;

import br.edu.ifba.socialgraph.source.SourceResponseExceptionMapper;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;

/**
 * REST client for the GitHub REST API v3.
 *
 * <p>Registered with the key "github-api":
 * <pre>
 * quarkus.rest-client.github-api.url=https://api.github.com
 * </pre>
 *
 * <p>{@code authorization} may be null for anonymous access (60 requests per hour).</p>
 */
@RegisterRestClient(configKey = "github-api")
@RegisterProvider(SourceResponseExceptionMapper.class)
@ClientHeaderParam(name = "Accept", value = "application/vnd.github+json")
@ClientHeaderParam(name = "X-GitHub-Api-Version", value = "2022-11-28")
public interface GitHubApiClient {

    @GET
    @Path("/users/{login}")
    JsonNode getUser(@PathParam("login") String login,
                     @HeaderParam("Authorization") String authorization);

    @GET
    @Path("/users/{login}/repos")
    JsonNode getUserRepositories(@PathParam("login") String login,
                                 @QueryParam("per_page") int perPage,
                                 @QueryParam("sort") String sort,
                                 @HeaderParam("Authorization") String authorization);

    @GET
    @Path("/users/{login}/followers")
    JsonNode getFollowers(@PathParam("login") String login,
                          @QueryParam("per_page") int perPage,
                          @HeaderParam("Authorization") String authorization);

    @GET
    @Path("/repos/{owner}/{repo}")
    JsonNode getRepository(@PathParam("owner") String owner,
                           @PathParam("repo") String repo,
                           @HeaderParam("Authorization") String authorization);

    @GET
    @Path("/repos/{owner}/{repo}/contributors")
    JsonNode getContributors(@PathParam("owner") String owner,
                             @PathParam("repo") String repo,
                             @QueryParam("per_page") int perPage,
                             @HeaderParam("Authorization") String authorization);
}
