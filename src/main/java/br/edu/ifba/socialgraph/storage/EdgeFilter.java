package br.edu.ifba.socialgraph.storage;

import java.util.UUID;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.socialgraph.core.RelationshipRecord;

/**
 * Criteria for scanning stored edges. {@code null} fields match everything.
 */
public record EdgeFilter(
    @Nullable String relationshipType,
    @Nullable UUID sourceNodeId,
    @Nullable UUID targetNodeId,
    @Nullable Double minWeight
) {

    public static final EdgeFilter ALL = new EdgeFilter(null, null, null, null);

    public EdgeFilter {
        if (relationshipType != null && relationshipType.isBlank()) {
            relationshipType = null;
        }
    }

    public boolean matches(RelationshipRecord edge) {
        return (relationshipType == null || relationshipType.equals(edge.getRelationshipType()))
            && (sourceNodeId == null || sourceNodeId.equals(edge.getSourceNodeId()))
            && (targetNodeId == null || targetNodeId.equals(edge.getTargetNodeId()))
            && (minWeight == null || edge.getWeight() >= minWeight);
    }
}
