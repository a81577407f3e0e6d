package br.edu.ifba.socialgraph.core;

import org.jetbrains.annotations.NotNull;

/**
 * Identity key of a node. Two discoveries with the same key are the same node.
 */
public record NodeIdentity(
    @NotNull SourceType source,
    @NotNull EntityType entityType,
    @NotNull String entityId
) {

    public NodeIdentity {
        if (source == null || entityType == null) {
            throw new IllegalArgumentException("source and entityType are required");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
    }

    public static NodeIdentity of(@NotNull EntityRecord entity) {
        return new NodeIdentity(entity.getSource(), entity.getEntityType(), entity.getEntityId());
    }

    @Override
    public String toString() {
        return source.getValue() + ":" + entityType.getValue() + ":" + entityId;
    }
}
