package br.edu.ifba.socialgraph.source.wikipedia;

import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import com.fasterxml.jackson.databind.JsonNode;

import br.edu.ifba.socialgraph.source.SourceResponseExceptionMapper;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * REST client for the MediaWiki action API ({@code action=query}, JSON format version 2).
 *
 * <pre>
 * quarkus.rest-client.wikipedia-api.url=https://en.wikipedia.org/w
 * </pre>
 *
 * Null query parameters are left out of the request. Flag parameters such as
 * {@code redirects} count as set whenever present, so callers pass {@code null} to unset them.
 */
@RegisterRestClient(configKey = "wikipedia-api")
@RegisterProvider(SourceResponseExceptionMapper.class)
@Produces(MediaType.APPLICATION_JSON)
public interface WikipediaApiClient {

    @GET
    @Path("/api.php")
    JsonNode query(@QueryParam("action") String action,
                   @QueryParam("format") String format,
                   @QueryParam("formatversion") Integer formatVersion,
                   @QueryParam("titles") String titles,
                   @QueryParam("redirects") String redirects,
                   @QueryParam("prop") String prop,
                   @QueryParam("inprop") String inprop,
                   @QueryParam("exintro") String exintro,
                   @QueryParam("explaintext") String explaintext,
                   @QueryParam("generator") String generator,
                   @QueryParam("gpllimit") Integer gplLimit,
                   @QueryParam("gplnamespace") Integer gplNamespace,
                   @QueryParam("clshow") String clShow,
                   @QueryParam("cllimit") Integer clLimit);

    /**
     * Page info plus the plain-text intro of one title, following redirects.
     */
    default JsonNode getPage(String title) {
        return query("query", "json", 2, title, "1", "info|extracts", "url", "1", "1",
            null, null, null, null, null);
    }

    /**
     * Info of the main-namespace pages a title links to.
     */
    default JsonNode getLinkedPages(String title, int limit) {
        return query("query", "json", 2, title, "1", "info", "url", null, null,
            "links", limit, 0, null, null);
    }

    /**
     * Non-hidden categories of a title.
     */
    default JsonNode getCategories(String title, int limit) {
        return query("query", "json", 2, title, "1", "categories", null, null, null,
            null, null, null, "!hidden", limit);
    }
}
