package br.edu.ifba.socialgraph.source;

import java.util.Map;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.RelationshipRecord;

/**
 * A neighbour found while expanding an entity, with the edge that links them.
 *
 * <p>Endpoints are unsaved records; the crawl engine upserts them and only then builds
 * the {@link RelationshipRecord} from the stored ids. {@code neighbor} is always one of
 * the two endpoints.</p>
 */
public record DiscoveredRelationship(
    @NotNull EntityRecord from,
    @NotNull EntityRecord to,
    @NotNull String relationshipType,
    double weight,
    @NotNull Map<String, Object> metadata,
    @NotNull EntityRecord neighbor
) {

    public DiscoveredRelationship {
        if (neighbor != from && neighbor != to) {
            throw new IllegalArgumentException("neighbor must be one of the endpoints");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("weight must not be negative");
        }
        metadata = metadata == null ? Map.of() : metadata;
    }

    /**
     * Edge from the expanded entity to the neighbour.
     */
    public static DiscoveredRelationship outgoing(EntityRecord expanded, EntityRecord neighbor,
            String relationshipType, double weight, Map<String, Object> metadata) {
        return new DiscoveredRelationship(expanded, neighbor, relationshipType, weight, metadata, neighbor);
    }

    /**
     * Edge from the neighbour to the expanded entity.
     */
    public static DiscoveredRelationship incoming(EntityRecord expanded, EntityRecord neighbor,
            String relationshipType, double weight, Map<String, Object> metadata) {
        return new DiscoveredRelationship(neighbor, expanded, relationshipType, weight, metadata, neighbor);
    }
}
