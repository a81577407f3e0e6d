package br.edu.ifba.socialgraph.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A directed, typed and weighted edge between two stored nodes.
 *
 * <p>{@code (source_node_id, target_node_id, relationship_type)} is unique.</p>
 */
public final class RelationshipRecord {

    public static final double DEFAULT_WEIGHT = 1.0;

    @JsonProperty("id")
    @Nullable
    private final UUID id;

    @JsonProperty("source_node_id")
    @NotNull
    private final UUID sourceNodeId;

    @JsonProperty("target_node_id")
    @NotNull
    private final UUID targetNodeId;

    @JsonProperty("relationship_type")
    @NotNull
    private final String relationshipType;

    @JsonProperty("weight")
    private final double weight;

    @JsonProperty("metadata")
    @NotNull
    private final Map<String, Object> metadata;

    @JsonProperty("created_at")
    @Nullable
    private final Instant createdAt;

    @JsonCreator
    public RelationshipRecord(
        @JsonProperty("id") @Nullable UUID id,
        @JsonProperty("source_node_id") @NotNull UUID sourceNodeId,
        @JsonProperty("target_node_id") @NotNull UUID targetNodeId,
        @JsonProperty("relationship_type") @NotNull String relationshipType,
        @JsonProperty("weight") @Nullable Double weight,
        @JsonProperty("metadata") @Nullable Map<String, Object> metadata,
        @JsonProperty("created_at") @Nullable Instant createdAt
    ) {
        this.id = id;
        this.sourceNodeId = Objects.requireNonNull(sourceNodeId, "sourceNodeId must not be null");
        this.targetNodeId = Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("relationshipType must not be blank");
        }
        this.relationshipType = relationshipType;
        double w = weight != null ? weight : DEFAULT_WEIGHT;
        if (w < 0 || Double.isNaN(w) || Double.isInfinite(w)) {
            throw new IllegalArgumentException("weight must be a non-negative finite number: " + w);
        }
        this.weight = w;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
        this.createdAt = createdAt;
    }

    public static RelationshipRecord of(@NotNull UUID sourceNodeId, @NotNull UUID targetNodeId,
            @NotNull String relationshipType, double weight, @Nullable Map<String, Object> metadata) {
        return new RelationshipRecord(null, sourceNodeId, targetNodeId, relationshipType, weight, metadata, null);
    }

    @Nullable
    public UUID getId() {
        return id;
    }

    @NotNull
    public UUID getSourceNodeId() {
        return sourceNodeId;
    }

    @NotNull
    public UUID getTargetNodeId() {
        return targetNodeId;
    }

    @NotNull
    public String getRelationshipType() {
        return relationshipType;
    }

    public double getWeight() {
        return weight;
    }

    @NotNull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Nullable
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonIgnore
    public EdgeKey key() {
        return new EdgeKey(sourceNodeId, targetNodeId, relationshipType);
    }

    /**
     * The node on the other end of this edge as seen from {@code nodeId}.
     */
    public UUID otherEnd(@NotNull UUID nodeId) {
        return sourceNodeId.equals(nodeId) ? targetNodeId : sourceNodeId;
    }

    public RelationshipRecord persisted(@NotNull UUID newId, @NotNull Instant created) {
        return new RelationshipRecord(newId, sourceNodeId, targetNodeId, relationshipType, weight, metadata, created);
    }

    /**
     * Merges a re-discovered edge into this stored one: the weight becomes the mean of
     * both observations and metadata is merged shallowly with incoming keys winning.
     */
    public RelationshipRecord mergeWith(@NotNull RelationshipRecord incoming) {
        if (!key().equals(incoming.key())) {
            throw new IllegalArgumentException("Cannot merge edge " + incoming.key() + " into " + key());
        }
        return new RelationshipRecord(id, sourceNodeId, targetNodeId, relationshipType,
            mergeWeights(weight, incoming.weight),
            EntityRecord.mergeMetadata(metadata, incoming.metadata), createdAt);
    }

    public static double mergeWeights(double current, double incoming) {
        return (current + incoming) / 2.0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RelationshipRecord)) {
            return false;
        }
        RelationshipRecord other = (RelationshipRecord) obj;
        return Objects.equals(id, other.id)
            && key().equals(other.key())
            && Double.compare(weight, other.weight) == 0
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceNodeId, targetNodeId, relationshipType);
    }

    @Override
    public String toString() {
        return "RelationshipRecord{" + sourceNodeId + " -[" + relationshipType + " " + weight + "]-> " + targetNodeId + "}";
    }

    /**
     * Uniqueness key of an edge.
     */
    public record EdgeKey(UUID sourceNodeId, UUID targetNodeId, String relationshipType) {
    }
}
