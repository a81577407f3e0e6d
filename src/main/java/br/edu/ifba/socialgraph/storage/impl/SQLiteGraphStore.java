package br.edu.ifba.socialgraph.storage.impl;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.core.UpsertResult;
import br.edu.ifba.socialgraph.shared.MonotonicClock;
import br.edu.ifba.socialgraph.shared.UuidUtils;
import br.edu.ifba.socialgraph.storage.EdgeFilter;
import br.edu.ifba.socialgraph.storage.GraphPage;
import br.edu.ifba.socialgraph.storage.GraphStore;
import br.edu.ifba.socialgraph.storage.GraphStoreConflictException;
import br.edu.ifba.socialgraph.storage.GraphStoreException;
import br.edu.ifba.socialgraph.storage.NodeFilter;

/**
 * SQLite-backed graph store over the {@code graph_nodes} and {@code graph_edges} tables.
 *
 * <p>Upserts read the current row and write the merged one on the exclusive write
 * connection inside a transaction, so concurrent writers to the same key are applied
 * one after the other and both merges survive. Timestamps are stored as epoch
 * microseconds.</p>
 */
public final class SQLiteGraphStore implements GraphStore {

    private static final Logger LOG = Logger.getLogger(SQLiteGraphStore.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final int IN_CLAUSE_CHUNK = 500;

    private static final String NODE_COLUMNS =
        "id, source, entity_type, entity_id, display_name, metadata, created_at, updated_at";
    private static final String EDGE_COLUMNS =
        "id, source_node_id, target_node_id, relationship_type, weight, metadata, created_at";

    private final SQLiteConnectionManager connectionManager;
    private final MonotonicClock clock;

    public SQLiteGraphStore(SQLiteConnectionManager connectionManager) {
        this(connectionManager, new MonotonicClock());
    }

    public SQLiteGraphStore(SQLiteConnectionManager connectionManager, MonotonicClock clock) {
        this.connectionManager = connectionManager;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Void> initialize() {
        return CompletableFuture.runAsync(() -> LOG.infof("Initialized SQLiteGraphStore at %s",
            connectionManager.getDatabasePath()));
    }

    // ========== Writes ==========

    @Override
    public CompletableFuture<UpsertResult<EntityRecord>> upsertNode(@NotNull EntityRecord entity) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                UpsertResult<EntityRecord> result = upsertNodeInTransaction(conn, entity);
                conn.commit();
                LOG.debugf("Upserted node %s (created=%s)", entity.identity(), result.created());
                return result;
            } catch (SQLException e) {
                rollback(conn);
                throw translate("Failed to upsert node " + entity.identity(), e);
            } catch (RuntimeException e) {
                rollback(conn);
                throw e;
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    private UpsertResult<EntityRecord> upsertNodeInTransaction(Connection conn, EntityRecord entity)
            throws SQLException {
        Optional<EntityRecord> existing = selectNodeByIdentity(conn,
            entity.getSource(), entity.getEntityType(), entity.getEntityId());
        Instant now = clock.now();

        if (existing.isPresent()) {
            EntityRecord merged = existing.get().mergeWith(entity, now);
            String sql = """
                UPDATE graph_nodes SET display_name = ?, metadata = ?, updated_at = ?
                WHERE id = ?
                """;
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                stmt.setString(1, merged.getDisplayName());
                stmt.setString(2, toJson(merged.getMetadata()));
                stmt.setLong(3, toMicros(now));
                stmt.setString(4, merged.getId().toString());
                stmt.executeUpdate();
            }
            return UpsertResult.merged(merged);
        }

        EntityRecord stored = entity.persisted(UuidUtils.randomV7(), now, now);
        String sql = "INSERT INTO graph_nodes (" + NODE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, stored.getId().toString());
            stmt.setString(2, stored.getSource().getValue());
            stmt.setString(3, stored.getEntityType().getValue());
            stmt.setString(4, stored.getEntityId());
            stmt.setString(5, stored.getDisplayName());
            stmt.setString(6, toJson(stored.getMetadata()));
            stmt.setLong(7, toMicros(now));
            stmt.setLong(8, toMicros(now));
            stmt.executeUpdate();
        }
        return UpsertResult.created(stored);
    }

    @Override
    public CompletableFuture<UpsertResult<RelationshipRecord>> upsertEdge(@NotNull RelationshipRecord relationship) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getWriteConnection();
            try {
                conn.setAutoCommit(false);
                requireNode(conn, relationship.getSourceNodeId());
                requireNode(conn, relationship.getTargetNodeId());
                UpsertResult<RelationshipRecord> result = upsertEdgeInTransaction(conn, relationship);
                conn.commit();
                LOG.debugf("Upserted edge %s (created=%s)", relationship, result.created());
                return result;
            } catch (SQLException e) {
                rollback(conn);
                throw translate("Failed to upsert edge " + relationship, e);
            } catch (RuntimeException e) {
                rollback(conn);
                throw e;
            } finally {
                resetAutoCommit(conn);
                connectionManager.releaseWriteConnection(conn);
            }
        });
    }

    private UpsertResult<RelationshipRecord> upsertEdgeInTransaction(Connection conn, RelationshipRecord edge)
            throws SQLException {
        String select = "SELECT " + EDGE_COLUMNS + " FROM graph_edges "
            + "WHERE source_node_id = ? AND target_node_id = ? AND relationship_type = ?";
        Optional<RelationshipRecord> existing;
        try (PreparedStatement stmt = conn.prepareStatement(select)) {
            stmt.setString(1, edge.getSourceNodeId().toString());
            stmt.setString(2, edge.getTargetNodeId().toString());
            stmt.setString(3, edge.getRelationshipType());
            try (ResultSet rs = stmt.executeQuery()) {
                existing = rs.next() ? Optional.of(mapEdge(rs)) : Optional.empty();
            }
        }

        if (existing.isPresent()) {
            RelationshipRecord merged = existing.get().mergeWith(edge);
            try (PreparedStatement stmt = conn.prepareStatement(
                    "UPDATE graph_edges SET weight = ?, metadata = ? WHERE id = ?")) {
                stmt.setDouble(1, merged.getWeight());
                stmt.setString(2, toJson(merged.getMetadata()));
                stmt.setString(3, merged.getId().toString());
                stmt.executeUpdate();
            }
            return UpsertResult.merged(merged);
        }

        RelationshipRecord stored = edge.persisted(UuidUtils.randomV7(), clock.now());
        String sql = "INSERT INTO graph_edges (" + EDGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, stored.getId().toString());
            stmt.setString(2, stored.getSourceNodeId().toString());
            stmt.setString(3, stored.getTargetNodeId().toString());
            stmt.setString(4, stored.getRelationshipType());
            stmt.setDouble(5, stored.getWeight());
            stmt.setString(6, toJson(stored.getMetadata()));
            stmt.setLong(7, toMicros(stored.getCreatedAt()));
            stmt.executeUpdate();
        }
        return UpsertResult.created(stored);
    }

    // ========== Reads ==========

    @Override
    public CompletableFuture<Optional<EntityRecord>> getNode(@NotNull UUID nodeId) {
        return read("get node " + nodeId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + NODE_COLUMNS + " FROM graph_nodes WHERE id = ?")) {
                stmt.setString(1, nodeId.toString());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(mapNode(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public CompletableFuture<Optional<EntityRecord>> getNodeByIdentity(
            @NotNull SourceType source, @NotNull EntityType entityType, @NotNull String entityId) {
        return read("get node by identity", conn -> selectNodeByIdentity(conn, source, entityType, entityId));
    }

    @Override
    public CompletableFuture<List<EntityRecord>> getNodes(@NotNull Collection<UUID> nodeIds) {
        List<UUID> ids = new ArrayList<>(new LinkedHashSet<>(nodeIds));
        if (ids.isEmpty()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        return read("get nodes", conn -> {
            List<EntityRecord> result = new ArrayList<>(ids.size());
            for (int start = 0; start < ids.size(); start += IN_CLAUSE_CHUNK) {
                List<UUID> chunk = ids.subList(start, Math.min(ids.size(), start + IN_CLAUSE_CHUNK));
                String sql = "SELECT " + NODE_COLUMNS + " FROM graph_nodes WHERE id IN ("
                    + placeholders(chunk.size()) + ") ORDER BY created_at";
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    for (int i = 0; i < chunk.size(); i++) {
                        stmt.setString(i + 1, chunk.get(i).toString());
                    }
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            result.add(mapNode(rs));
                        }
                    }
                }
            }
            return result;
        });
    }

    @Override
    public CompletableFuture<List<RelationshipRecord>> getEdges(@NotNull UUID nodeId, @NotNull Direction direction) {
        String where = switch (direction) {
            case OUTGOING -> "source_node_id = ?1";
            case INCOMING -> "target_node_id = ?1";
            case BOTH -> "source_node_id = ?1 OR target_node_id = ?1";
        };
        return read("get edges of " + nodeId, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + EDGE_COLUMNS + " FROM graph_edges WHERE " + where)) {
                stmt.setString(1, nodeId.toString());
                return mapEdges(stmt);
            }
        });
    }

    @Override
    public CompletableFuture<List<EntityRecord>> getNodesBatch(int offset, int limit) {
        validatePage(offset, limit);
        return read("get node batch", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + NODE_COLUMNS + " FROM graph_nodes ORDER BY created_at, id LIMIT ? OFFSET ?")) {
                stmt.setInt(1, limit);
                stmt.setInt(2, offset);
                List<EntityRecord> result = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        result.add(mapNode(rs));
                    }
                }
                return result;
            }
        });
    }

    @Override
    public CompletableFuture<List<RelationshipRecord>> getEdgesBatch(int offset, int limit) {
        validatePage(offset, limit);
        return read("get edge batch", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT " + EDGE_COLUMNS + " FROM graph_edges ORDER BY created_at, id LIMIT ? OFFSET ?")) {
                stmt.setInt(1, limit);
                stmt.setInt(2, offset);
                return mapEdges(stmt);
            }
        });
    }

    @Override
    public CompletableFuture<GraphPage<EntityRecord>> findNodes(@NotNull NodeFilter filter, int offset, int limit) {
        validatePage(offset, limit);
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (filter.source() != null) {
            conditions.add("source = ?");
            params.add(filter.source().getValue());
        }
        if (filter.entityType() != null) {
            conditions.add("entity_type = ?");
            params.add(filter.entityType().getValue());
        }
        if (filter.nameContains() != null) {
            conditions.add("display_name LIKE ? ESCAPE '\\'");
            params.add(likePattern(filter.nameContains()));
        }
        if (filter.textContains() != null) {
            conditions.add("(display_name LIKE ? ESCAPE '\\' OR entity_id LIKE ? ESCAPE '\\')");
            params.add(likePattern(filter.textContains()));
            params.add(likePattern(filter.textContains()));
        }
        String where = whereClause(conditions);
        return read("find nodes", conn -> {
            long total = count(conn, "SELECT COUNT(*) FROM graph_nodes" + where, params);
            List<EntityRecord> items = new ArrayList<>();
            String sql = "SELECT " + NODE_COLUMNS + " FROM graph_nodes" + where
                + " ORDER BY created_at, id LIMIT ? OFFSET ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = bind(stmt, params);
                stmt.setInt(index, limit);
                stmt.setInt(index + 1, offset);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        items.add(mapNode(rs));
                    }
                }
            }
            return new GraphPage<>(items, total);
        });
    }

    @Override
    public CompletableFuture<GraphPage<RelationshipRecord>> findEdges(@NotNull EdgeFilter filter, int offset, int limit) {
        validatePage(offset, limit);
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        if (filter.relationshipType() != null) {
            conditions.add("relationship_type = ?");
            params.add(filter.relationshipType());
        }
        if (filter.sourceNodeId() != null) {
            conditions.add("source_node_id = ?");
            params.add(filter.sourceNodeId().toString());
        }
        if (filter.targetNodeId() != null) {
            conditions.add("target_node_id = ?");
            params.add(filter.targetNodeId().toString());
        }
        if (filter.minWeight() != null) {
            conditions.add("weight >= ?");
            params.add(filter.minWeight());
        }
        String where = whereClause(conditions);
        return read("find edges", conn -> {
            long total = count(conn, "SELECT COUNT(*) FROM graph_edges" + where, params);
            String sql = "SELECT " + EDGE_COLUMNS + " FROM graph_edges" + where
                + " ORDER BY created_at, id LIMIT ? OFFSET ?";
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                int index = bind(stmt, params);
                stmt.setInt(index, limit);
                stmt.setInt(index + 1, offset);
                return new GraphPage<>(mapEdges(stmt), total);
            }
        });
    }

    @Override
    public CompletableFuture<Long> countNodes() {
        return read("count nodes", conn -> count(conn, "SELECT COUNT(*) FROM graph_nodes"));
    }

    @Override
    public CompletableFuture<Long> countEdges() {
        return read("count edges", conn -> count(conn, "SELECT COUNT(*) FROM graph_edges"));
    }

    @Override
    public void close() {
        LOG.info("SQLiteGraphStore closed");
    }

    // ========== Helpers ==========

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> CompletableFuture<T> read(String operation, SqlFunction<T> query) {
        return CompletableFuture.supplyAsync(() -> {
            Connection conn = connectionManager.getReadConnection();
            try {
                return query.apply(conn);
            } catch (SQLException e) {
                throw translate("Failed to " + operation, e);
            } finally {
                connectionManager.releaseReadConnection(conn);
            }
        });
    }

    private Optional<EntityRecord> selectNodeByIdentity(Connection conn, SourceType source,
            EntityType entityType, String entityId) throws SQLException {
        String sql = "SELECT " + NODE_COLUMNS + " FROM graph_nodes "
            + "WHERE source = ? AND entity_type = ? AND entity_id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, source.getValue());
            stmt.setString(2, entityType.getValue());
            stmt.setString(3, entityId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(mapNode(rs)) : Optional.empty();
            }
        }
    }

    private void requireNode(Connection conn, UUID nodeId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM graph_nodes WHERE id = ?")) {
            stmt.setString(1, nodeId.toString());
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalArgumentException("Edge endpoint does not exist: " + nodeId);
                }
            }
        }
    }

    private long count(Connection conn, String sql) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private long count(Connection conn, String sql, List<Object> params) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    /**
     * @return the next free parameter index
     */
    private static int bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        int index = 1;
        for (Object param : params) {
            if (param instanceof Double number) {
                stmt.setDouble(index++, number);
            } else {
                stmt.setString(index++, (String) param);
            }
        }
        return index;
    }

    private static String whereClause(List<String> conditions) {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    // LIKE is case-insensitive for ASCII in SQLite
    private static String likePattern(String fragment) {
        String escaped = fragment.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private List<RelationshipRecord> mapEdges(PreparedStatement stmt) throws SQLException {
        List<RelationshipRecord> result = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                result.add(mapEdge(rs));
            }
        }
        return result;
    }

    private EntityRecord mapNode(ResultSet rs) throws SQLException {
        return new EntityRecord(
            UUID.fromString(rs.getString("id")),
            EntityType.fromValue(rs.getString("entity_type")),
            rs.getString("entity_id"),
            SourceType.fromValue(rs.getString("source")),
            rs.getString("display_name"),
            fromJson(rs.getString("metadata")),
            fromMicros(rs.getLong("created_at")),
            fromMicros(rs.getLong("updated_at")));
    }

    private RelationshipRecord mapEdge(ResultSet rs) throws SQLException {
        return new RelationshipRecord(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("source_node_id")),
            UUID.fromString(rs.getString("target_node_id")),
            rs.getString("relationship_type"),
            rs.getDouble("weight"),
            fromJson(rs.getString("metadata")),
            fromMicros(rs.getLong("created_at")));
    }

    private static GraphStoreException translate(String message, SQLException e) {
        if (e instanceof SQLiteException sqliteException
                && sqliteException.getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) {
            return new GraphStoreConflictException(message, e);
        }
        return new GraphStoreException(message, e);
    }

    private static void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.warn("Failed to rollback", e);
        }
    }

    private static void resetAutoCommit(Connection conn) {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            LOG.warn("Failed to reset auto-commit", e);
        }
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static void validatePage(int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("offset must be >= 0 and limit > 0");
        }
    }

    static long toMicros(Instant instant) {
        return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000L;
    }

    static Instant fromMicros(long micros) {
        return Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
    }

    private static String toJson(Map<String, Object> metadata) {
        try {
            return OBJECT_MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable to JSON", e);
        }
    }

    private static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return OBJECT_MAPPER.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warnf("Failed to parse metadata JSON: %s", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
