package br.edu.ifba.socialgraph.storage.impl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.NodeIdentity;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.RelationshipRecord.EdgeKey;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.core.UpsertResult;
import br.edu.ifba.socialgraph.shared.MonotonicClock;
import br.edu.ifba.socialgraph.shared.UuidUtils;
import br.edu.ifba.socialgraph.storage.EdgeFilter;
import br.edu.ifba.socialgraph.storage.GraphPage;
import br.edu.ifba.socialgraph.storage.GraphStore;
import br.edu.ifba.socialgraph.storage.NodeFilter;

/**
 * In-memory graph store backed by concurrent adjacency maps.
 * Merges are done inside {@link ConcurrentHashMap#compute} so racing upserts on one
 * identity key serialize on that key only.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private static final Comparator<EntityRecord> NODE_ORDER =
        Comparator.comparing(EntityRecord::getCreatedAt).thenComparing(EntityRecord::getId);
    private static final Comparator<RelationshipRecord> EDGE_ORDER =
        Comparator.comparing(RelationshipRecord::getCreatedAt).thenComparing(RelationshipRecord::getId);

    // identity -> stored node
    private final ConcurrentHashMap<NodeIdentity, EntityRecord> nodesByIdentity = new ConcurrentHashMap<>();

    // id -> identity
    private final ConcurrentHashMap<UUID, NodeIdentity> identityById = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<EdgeKey, RelationshipRecord> edges = new ConcurrentHashMap<>();

    // nodeId -> keys of edges leaving / entering it
    private final ConcurrentHashMap<UUID, Set<EdgeKey>> outgoingEdges = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, Set<EdgeKey>> incomingEdges = new ConcurrentHashMap<>();

    private final MonotonicClock clock;
    private volatile boolean initialized = false;

    public InMemoryGraphStore() {
        this(new MonotonicClock());
    }

    public InMemoryGraphStore(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> {
            if (!initialized) {
                initialized = true;
                logger.info("InMemoryGraphStore initialized");
            }
        });
    }

    @Override
    public CompletableFuture<UpsertResult<EntityRecord>> upsertNode(@NotNull EntityRecord entity) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            AtomicBoolean created = new AtomicBoolean(false);
            EntityRecord stored = nodesByIdentity.compute(entity.identity(), (identity, existing) -> {
                Instant now = clock.now();
                if (existing == null) {
                    created.set(true);
                    return entity.persisted(UuidUtils.randomV7(), now, now);
                }
                return existing.mergeWith(entity, now);
            });
            identityById.putIfAbsent(stored.getId(), stored.identity());
            logger.debug("Upserted node {} (created={})", stored.identity(), created.get());
            return new UpsertResult<>(stored, created.get());
        });
    }

    @Override
    public CompletableFuture<UpsertResult<RelationshipRecord>> upsertEdge(@NotNull RelationshipRecord relationship) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            requireNode(relationship.getSourceNodeId());
            requireNode(relationship.getTargetNodeId());

            AtomicBoolean created = new AtomicBoolean(false);
            EdgeKey key = relationship.key();
            RelationshipRecord stored = edges.compute(key, (k, existing) -> {
                if (existing == null) {
                    created.set(true);
                    return relationship.persisted(UuidUtils.randomV7(), clock.now());
                }
                return existing.mergeWith(relationship);
            });
            if (created.get()) {
                outgoingEdges.computeIfAbsent(key.sourceNodeId(), id -> ConcurrentHashMap.newKeySet()).add(key);
                incomingEdges.computeIfAbsent(key.targetNodeId(), id -> ConcurrentHashMap.newKeySet()).add(key);
            }
            logger.debug("Upserted edge {} (created={})", stored, created.get());
            return new UpsertResult<>(stored, created.get());
        });
    }

    @Override
    public CompletableFuture<Optional<EntityRecord>> getNode(@NotNull UUID nodeId) {
        ensureInitialized();
        return CompletableFuture.completedFuture(lookup(nodeId));
    }

    @Override
    public CompletableFuture<Optional<EntityRecord>> getNodeByIdentity(
            @NotNull SourceType source, @NotNull EntityType entityType, @NotNull String entityId) {
        ensureInitialized();
        return CompletableFuture.completedFuture(
            Optional.ofNullable(nodesByIdentity.get(new NodeIdentity(source, entityType, entityId))));
    }

    @Override
    public CompletableFuture<List<EntityRecord>> getNodes(@NotNull Collection<UUID> nodeIds) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            List<EntityRecord> result = new ArrayList<>();
            for (UUID id : new LinkedHashSet<>(nodeIds)) {
                lookup(id).ifPresent(result::add);
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<List<RelationshipRecord>> getEdges(@NotNull UUID nodeId, @NotNull Direction direction) {
        ensureInitialized();
        return CompletableFuture.supplyAsync(() -> {
            Set<EdgeKey> keys = new LinkedHashSet<>();
            if (direction.includesOutgoing()) {
                keys.addAll(outgoingEdges.getOrDefault(nodeId, Set.of()));
            }
            if (direction.includesIncoming()) {
                keys.addAll(incomingEdges.getOrDefault(nodeId, Set.of()));
            }
            List<RelationshipRecord> result = new ArrayList<>(keys.size());
            for (EdgeKey key : keys) {
                RelationshipRecord edge = edges.get(key);
                if (edge != null) {
                    result.add(edge);
                }
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<List<EntityRecord>> getNodesBatch(int offset, int limit) {
        ensureInitialized();
        validatePage(offset, limit);
        return CompletableFuture.supplyAsync(() -> nodesByIdentity.values().stream()
            .sorted(NODE_ORDER)
            .skip(offset)
            .limit(limit)
            .toList());
    }

    @Override
    public CompletableFuture<List<RelationshipRecord>> getEdgesBatch(int offset, int limit) {
        ensureInitialized();
        validatePage(offset, limit);
        return CompletableFuture.supplyAsync(() -> edges.values().stream()
            .sorted(EDGE_ORDER)
            .skip(offset)
            .limit(limit)
            .toList());
    }

    @Override
    public CompletableFuture<GraphPage<EntityRecord>> findNodes(@NotNull NodeFilter filter, int offset, int limit) {
        ensureInitialized();
        validatePage(offset, limit);
        return CompletableFuture.supplyAsync(() -> {
            List<EntityRecord> matching = nodesByIdentity.values().stream()
                .filter(filter::matches)
                .sorted(NODE_ORDER)
                .toList();
            return new GraphPage<>(slice(matching, offset, limit), matching.size());
        });
    }

    @Override
    public CompletableFuture<GraphPage<RelationshipRecord>> findEdges(@NotNull EdgeFilter filter, int offset, int limit) {
        ensureInitialized();
        validatePage(offset, limit);
        return CompletableFuture.supplyAsync(() -> {
            List<RelationshipRecord> matching = edges.values().stream()
                .filter(filter::matches)
                .sorted(EDGE_ORDER)
                .toList();
            return new GraphPage<>(slice(matching, offset, limit), matching.size());
        });
    }

    @Override
    public CompletableFuture<Long> countNodes() {
        ensureInitialized();
        return CompletableFuture.completedFuture((long) nodesByIdentity.size());
    }

    @Override
    public CompletableFuture<Long> countEdges() {
        ensureInitialized();
        return CompletableFuture.completedFuture((long) edges.size());
    }

    @Override
    public void close() {
        nodesByIdentity.clear();
        identityById.clear();
        edges.clear();
        outgoingEdges.clear();
        incomingEdges.clear();
        initialized = false;
        logger.info("InMemoryGraphStore closed");
    }

    private Optional<EntityRecord> lookup(UUID nodeId) {
        NodeIdentity identity = identityById.get(nodeId);
        return identity == null ? Optional.empty() : Optional.ofNullable(nodesByIdentity.get(identity));
    }

    private void requireNode(UUID nodeId) {
        if (!identityById.containsKey(nodeId)) {
            throw new IllegalArgumentException("Edge endpoint does not exist: " + nodeId);
        }
    }

    private static <T> List<T> slice(List<T> items, int offset, int limit) {
        int from = Math.min(offset, items.size());
        int to = (int) Math.min((long) from + limit, items.size());
        return items.subList(from, to);
    }

    private static void validatePage(int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("offset must be >= 0 and limit > 0");
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Storage not initialized. Call initialize() first.");
        }
    }
}
