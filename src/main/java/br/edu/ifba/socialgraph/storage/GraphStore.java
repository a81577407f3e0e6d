package br.edu.ifba.socialgraph.storage;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.core.UpsertResult;

/**
 * Persistence primitives for the social graph.
 *
 * <p>Both the crawl engine (writes) and the query service (reads) use this contract.
 * Implementations are shared by concurrent crawl workers across jobs and by query
 * reads, so every method must be safe to call from any thread.</p>
 *
 * <p>Upserts deduplicate on identity keys:</p>
 * <ul>
 *   <li>nodes on {@code (source, entity_type, entity_id)}</li>
 *   <li>edges on {@code (source_node_id, target_node_id, relationship_type)}</li>
 * </ul>
 * <p>Metadata is merged shallowly (incoming keys win, missing keys are kept). Concurrent
 * upserts racing on one key must converge to a single stored record that contains the
 * merge of both writes.</p>
 *
 * <p>Implementations: InMemoryGraphStore, SQLiteGraphStore</p>
 */
public interface GraphStore extends AutoCloseable {

    /**
     * Initializes the backend. Must complete before any other operation.
     */
    CompletableFuture<Void> initialize();

    // ===== Writes =====

    /**
     * Inserts a node or merges it into the existing node with the same identity key.
     *
     * <p>On merge the stored id and {@code created_at} are kept, the display name is
     * replaced and {@code updated_at} advances.</p>
     *
     * @param entity the discovered node (its id and timestamps are ignored)
     * @return the stored record and whether this call created it
     */
    CompletableFuture<UpsertResult<EntityRecord>> upsertNode(@NotNull EntityRecord entity);

    /**
     * Inserts an edge or merges it into the existing edge with the same key.
     *
     * <p>A re-discovered edge keeps its id and {@code created_at}; its weight becomes the
     * mean of the stored and incoming weights.</p>
     *
     * @param relationship the edge; both endpoints must already be stored
     * @return the stored record and whether this call created it
     * @throws IllegalArgumentException (wrapped in the future) if an endpoint does not exist
     */
    CompletableFuture<UpsertResult<RelationshipRecord>> upsertEdge(@NotNull RelationshipRecord relationship);

    // ===== Reads =====

    CompletableFuture<Optional<EntityRecord>> getNode(@NotNull UUID nodeId);

    CompletableFuture<Optional<EntityRecord>> getNodeByIdentity(
        @NotNull SourceType source, @NotNull EntityType entityType, @NotNull String entityId);

    /**
     * Retrieves several nodes at once. Unknown ids are skipped.
     */
    CompletableFuture<List<EntityRecord>> getNodes(@NotNull Collection<UUID> nodeIds);

    /**
     * Retrieves the edges touching a node.
     *
     * @param nodeId the node
     * @param direction {@code OUTGOING} for edges starting at the node, {@code INCOMING}
     *                  for edges ending at it, {@code BOTH} for either
     * @return the edges, in no particular order; empty if the node has none
     */
    CompletableFuture<List<RelationshipRecord>> getEdges(@NotNull UUID nodeId, @NotNull Direction direction);

    /**
     * Pages through all nodes in a stable order.
     */
    CompletableFuture<List<EntityRecord>> getNodesBatch(int offset, int limit);

    /**
     * Pages through all edges in a stable order.
     */
    CompletableFuture<List<RelationshipRecord>> getEdgesBatch(int offset, int limit);

    /**
     * Nodes matching {@code filter} in creation order, skipping {@code offset} of them.
     *
     * @return at most {@code limit} nodes and the total number of matches
     */
    CompletableFuture<GraphPage<EntityRecord>> findNodes(@NotNull NodeFilter filter, int offset, int limit);

    /**
     * Edges matching {@code filter} in creation order, skipping {@code offset} of them.
     *
     * @return at most {@code limit} edges and the total number of matches
     */
    CompletableFuture<GraphPage<RelationshipRecord>> findEdges(@NotNull EdgeFilter filter, int offset, int limit);

    CompletableFuture<Long> countNodes();

    CompletableFuture<Long> countEdges();

    @Override
    void close();
}
