package br.edu.ifba.socialgraph.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.RelationshipRecord;

/**
 * A direct edge of the queried node together with the node at its other end.
 * {@code direction} is {@code outgoing} when the queried node is the edge source.
 */
public record NeighborResult(
    @JsonProperty("edge") RelationshipRecord edge,
    @JsonProperty("node") EntityRecord node,
    @JsonProperty("direction") Direction direction
) {
}
