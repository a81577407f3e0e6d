package br.edu.ifba.socialgraph.query;

import java.util.List;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.shared.UuidUtils;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Read-only graph endpoints. Every traversal accepts {@code fresh=true} to skip the cache.
 */
@Path("/api/v1/graph")
@Produces(MediaType.APPLICATION_JSON)
public class GraphResources {

    @Inject
    CachedGraphQueryService queryService;

    @Inject
    GraphQueryService graphQueryService;

    @POST
    @Path("/query")
    @Consumes(MediaType.APPLICATION_JSON)
    public SubgraphResult query(@Valid @NotNull final GraphQueryRequest request,
                                @QueryParam("fresh") @DefaultValue("false") final boolean fresh) {
        return queryService.subgraph(
                request.startNodeId(),
                request.depthOrDefault(),
                request.maxNodesOrDefault(),
                request.directionOrDefault(),
                request.relationshipTypes(),
                fresh);
    }

    @GET
    @Path("/nodes/{id}/neighbors")
    public List<NeighborResult> neighbors(@PathParam("id") final String id,
                                          @QueryParam("direction") @DefaultValue("both") final String direction,
                                          @QueryParam("limit") @DefaultValue("50") final int limit,
                                          @QueryParam("type") final List<String> relationshipTypes,
                                          @QueryParam("fresh") @DefaultValue("false") final boolean fresh) {
        return queryService.neighbors(
                UuidUtils.parse(id, "id"),
                Direction.fromValue(direction),
                limit,
                relationshipTypes,
                fresh);
    }

    @GET
    @Path("/path")
    public PathResult path(@QueryParam("from") final String from,
                           @QueryParam("to") final String to,
                           @QueryParam("max_depth") @DefaultValue("5") final int maxDepth,
                           @QueryParam("fresh") @DefaultValue("false") final boolean fresh) {
        return queryService.shortestPath(UuidUtils.parse(from, "from"), UuidUtils.parse(to, "to"), maxDepth, fresh);
    }

    @GET
    @Path("/stats")
    public GraphStats stats(@QueryParam("fresh") @DefaultValue("false") final boolean fresh) {
        return queryService.stats(fresh);
    }

    @GET
    @Path("/nodes/{id}")
    public EntityRecord node(@PathParam("id") final String id) {
        return graphQueryService.getNode(UuidUtils.parse(id, "id"));
    }

    @GET
    @Path("/nodes")
    public ResultPage<EntityRecord> listNodes(@QueryParam("source") final String source,
                                              @QueryParam("type") final String type,
                                              @QueryParam("search") final String search,
                                              @QueryParam("page") @DefaultValue("1") final int page,
                                              @QueryParam("page_size") @DefaultValue("50") final int pageSize) {
        return graphQueryService.listNodes(
                source != null ? SourceType.fromValue(source) : null,
                type != null ? EntityType.fromValue(type) : null,
                search,
                page,
                pageSize);
    }

    @GET
    @Path("/nodes/search")
    public List<EntityRecord> searchNodes(@QueryParam("q") final String query,
                                          @QueryParam("limit") @DefaultValue("20") final int limit) {
        return graphQueryService.searchNodes(query, limit);
    }

    @GET
    @Path("/nodes/lookup")
    public EntityRecord findNode(@QueryParam("source") final String source,
                                 @QueryParam("type") final String type,
                                 @QueryParam("entityId") final String entityId) {
        return graphQueryService.findNode(SourceType.fromValue(source), EntityType.fromValue(type), entityId);
    }

    @GET
    @Path("/edges")
    public ResultPage<RelationshipRecord> listEdges(@QueryParam("type") final String relationshipType,
                                                    @QueryParam("source_node_id") final String sourceNodeId,
                                                    @QueryParam("target_node_id") final String targetNodeId,
                                                    @QueryParam("min_weight") final Double minWeight,
                                                    @QueryParam("page") @DefaultValue("1") final int page,
                                                    @QueryParam("page_size") @DefaultValue("50") final int pageSize) {
        return graphQueryService.listEdges(
                relationshipType,
                sourceNodeId != null ? UuidUtils.parse(sourceNodeId, "source_node_id") : null,
                targetNodeId != null ? UuidUtils.parse(targetNodeId, "target_node_id") : null,
                minWeight,
                page,
                pageSize);
    }
}
