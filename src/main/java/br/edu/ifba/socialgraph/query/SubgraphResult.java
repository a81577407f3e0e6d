package br.edu.ifba.socialgraph.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.RelationshipRecord;

/**
 * Nodes and edges reached by a bounded traversal, in visit order.
 * {@code truncated} is set when the node cap stopped the traversal early.
 */
public record SubgraphResult(
    @JsonProperty("nodes") List<EntityRecord> nodes,
    @JsonProperty("edges") List<RelationshipRecord> edges,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount,
    @JsonProperty("truncated") boolean truncated
) {

    public static SubgraphResult of(List<EntityRecord> nodes, List<RelationshipRecord> edges, boolean truncated) {
        return new SubgraphResult(List.copyOf(nodes), List.copyOf(edges), nodes.size(), edges.size(), truncated);
    }
}
