package br.edu.ifba.socialgraph.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.RelationshipRecord;

/**
 * Ordered nodes from source to target and the edges between consecutive nodes.
 * {@code length} counts hops.
 */
public record PathResult(
    @JsonProperty("path") List<EntityRecord> path,
    @JsonProperty("edges") List<RelationshipRecord> edges,
    @JsonProperty("length") int length,
    @JsonProperty("total_weight") double totalWeight
) {
}
