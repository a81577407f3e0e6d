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
 * A node of the social graph.
 *
 * <p>Adapters build records without {@code id} or timestamps; the graph store assigns
 * them on first insert. {@code (source, entity_type, entity_id)} is the identity key.</p>
 *
 * <p>Metadata is an opaque JSON-like map (strings, numbers, booleans, nested maps, lists).</p>
 */
public final class EntityRecord {

    @JsonProperty("id")
    @Nullable
    private final UUID id;

    @JsonProperty("entity_type")
    @NotNull
    private final EntityType entityType;

    @JsonProperty("entity_id")
    @NotNull
    private final String entityId;

    @JsonProperty("source")
    @NotNull
    private final SourceType source;

    @JsonProperty("display_name")
    @NotNull
    private final String displayName;

    @JsonProperty("metadata")
    @NotNull
    private final Map<String, Object> metadata;

    @JsonProperty("created_at")
    @Nullable
    private final Instant createdAt;

    @JsonProperty("updated_at")
    @Nullable
    private final Instant updatedAt;

    @JsonCreator
    public EntityRecord(
        @JsonProperty("id") @Nullable UUID id,
        @JsonProperty("entity_type") @NotNull EntityType entityType,
        @JsonProperty("entity_id") @NotNull String entityId,
        @JsonProperty("source") @NotNull SourceType source,
        @JsonProperty("display_name") @Nullable String displayName,
        @JsonProperty("metadata") @Nullable Map<String, Object> metadata,
        @JsonProperty("created_at") @Nullable Instant createdAt,
        @JsonProperty("updated_at") @Nullable Instant updatedAt
    ) {
        this.id = id;
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null");
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.displayName = displayName != null ? displayName : entityId;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @Nullable
    public UUID getId() {
        return id;
    }

    @NotNull
    public EntityType getEntityType() {
        return entityType;
    }

    @NotNull
    public String getEntityId() {
        return entityId;
    }

    @NotNull
    public SourceType getSource() {
        return source;
    }

    @NotNull
    public String getDisplayName() {
        return displayName;
    }

    @NotNull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Nullable
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Nullable
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonIgnore
    public NodeIdentity identity() {
        return NodeIdentity.of(this);
    }

    /**
     * Returns a stored copy of this record carrying the given id and timestamps.
     */
    public EntityRecord persisted(@NotNull UUID newId, @NotNull Instant created, @NotNull Instant updated) {
        return new EntityRecord(newId, entityType, entityId, source, displayName, metadata, created, updated);
    }

    /**
     * Merges a re-discovered version of this node into this stored one.
     *
     * <p>The display name is replaced. Metadata is merged shallowly: keys of the incoming
     * record win, keys it does not carry are preserved. Id and creation time never change.</p>
     *
     * @param incoming the freshly discovered record with the same identity
     * @param updated the new update timestamp
     * @return the merged record
     */
    public EntityRecord mergeWith(@NotNull EntityRecord incoming, @NotNull Instant updated) {
        if (!identity().equals(incoming.identity())) {
            throw new IllegalArgumentException("Cannot merge " + incoming.identity() + " into " + identity());
        }
        return new EntityRecord(id, entityType, entityId, source, incoming.displayName,
            mergeMetadata(metadata, incoming.metadata), createdAt, updated);
    }

    static Map<String, Object> mergeMetadata(Map<String, Object> current, Map<String, Object> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>(current);
        merged.putAll(incoming);
        return merged;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof EntityRecord)) {
            return false;
        }
        EntityRecord other = (EntityRecord) obj;
        return Objects.equals(id, other.id)
            && entityType == other.entityType
            && entityId.equals(other.entityId)
            && source == other.source
            && displayName.equals(other.displayName)
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityType, entityId, source);
    }

    @Override
    public String toString() {
        return "EntityRecord{id=" + id + ", identity=" + identity() + ", displayName='" + displayName + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UUID id;
        private EntityType entityType;
        private String entityId;
        private SourceType source;
        private String displayName;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(@Nullable UUID id) {
            this.id = id;
            return this;
        }

        public Builder entityType(@NotNull EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(@NotNull String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder source(@NotNull SourceType source) {
            this.source = source;
            return this;
        }

        public Builder displayName(@Nullable String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder putMetadata(@NotNull String key, @Nullable Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(@Nullable Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public EntityRecord build() {
            return new EntityRecord(id, entityType, entityId, source, displayName, metadata, createdAt, updatedAt);
        }
    }
}
