package br.edu.ifba.socialgraph.query;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.socialgraph.core.Direction;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record GraphQueryRequest(
        @NotNull(message = "start_node_id is required")
        @JsonProperty("start_node_id") UUID startNodeId,

        @Min(value = 1, message = "Depth must be at least 1")
        @Max(value = GraphQueryService.MAX_DEPTH, message = "Depth must be at most 5")
        @JsonProperty("depth") Integer depth,

        @Min(value = 1, message = "max_nodes must be at least 1")
        @Max(value = GraphQueryService.MAX_NODES, message = "max_nodes must be at most 5000")
        @JsonProperty("max_nodes") Integer maxNodes,

        @JsonProperty("direction") Direction direction,

        @JsonProperty("relationship_types") List<String> relationshipTypes
) {

    public int depthOrDefault() {
        return depth != null ? depth : GraphQueryService.DEFAULT_DEPTH;
    }

    public int maxNodesOrDefault() {
        return maxNodes != null ? maxNodes : GraphQueryService.DEFAULT_MAX_NODES;
    }

    public Direction directionOrDefault() {
        return direction != null ? direction : Direction.BOTH;
    }
}
