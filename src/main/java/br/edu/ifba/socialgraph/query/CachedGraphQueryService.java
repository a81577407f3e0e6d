package br.edu.ifba.socialgraph.query;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import br.edu.ifba.socialgraph.cache.CacheConfig;
import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.storage.CacheStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Read-through cache in front of {@link GraphQueryService}.
 *
 * <h2>Cache Key Computation:</h2>
 * <p>The operation name and its parameters are rendered as
 * {@code op|name=value|...} with parameters in name order and collection values sorted,
 * then hashed with SHA-256. Keys look like {@code graph:subgraph:<hash>}.</p>
 *
 * <p>Entries expire after {@code socialgraph.cache.ttl}. Crawls do not invalidate them,
 * so a result can be up to one TTL old; callers pass {@code fresh = true} to skip the
 * lookup. A fresh result still refreshes the entry.</p>
 */
@ApplicationScoped
public class CachedGraphQueryService {

    private static final Logger logger = LoggerFactory.getLogger(CachedGraphQueryService.class);

    static final String KEY_NAMESPACE = "graph";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final GraphQueryService delegate;
    private final CacheStore cacheStore;
    private final CacheConfig config;

    @Inject
    public CachedGraphQueryService(GraphQueryService delegate, CacheStore cacheStore, CacheConfig config) {
        this.delegate = delegate;
        this.cacheStore = cacheStore;
        this.config = config;
    }

    public SubgraphResult subgraph(UUID startNodeId, int depth, int maxNodes, Direction direction,
            Collection<String> relationshipTypes, boolean fresh) {
        Map<String, Object> params = new TreeMap<>();
        params.put("start", startNodeId);
        params.put("depth", depth);
        params.put("max_nodes", maxNodes);
        params.put("direction", direction != null ? direction : Direction.BOTH);
        params.put("types", relationshipTypes);
        return cached("subgraph", params, fresh, OBJECT_MAPPER.constructType(SubgraphResult.class),
            () -> delegate.subgraph(startNodeId, depth, maxNodes, direction, relationshipTypes));
    }

    public List<NeighborResult> neighbors(UUID nodeId, Direction direction, int limit,
            Collection<String> relationshipTypes, boolean fresh) {
        Map<String, Object> params = new TreeMap<>();
        params.put("node", nodeId);
        params.put("direction", direction != null ? direction : Direction.BOTH);
        params.put("limit", limit);
        params.put("types", relationshipTypes);
        return cached("neighbors", params, fresh,
            OBJECT_MAPPER.getTypeFactory().constructType(new TypeReference<List<NeighborResult>>() { }),
            () -> delegate.neighbors(nodeId, direction, limit, relationshipTypes));
    }

    public PathResult shortestPath(UUID fromNodeId, UUID toNodeId, int maxDepth, boolean fresh) {
        Map<String, Object> params = new TreeMap<>();
        params.put("from", fromNodeId);
        params.put("to", toNodeId);
        params.put("max_depth", maxDepth);
        return cached("path", params, fresh, OBJECT_MAPPER.constructType(PathResult.class),
            () -> delegate.shortestPath(fromNodeId, toNodeId, maxDepth));
    }

    public GraphStats stats(boolean fresh) {
        return cached("stats", Map.of(), fresh, OBJECT_MAPPER.constructType(GraphStats.class), delegate::stats);
    }

    private <T> T cached(String operation, Map<String, Object> params, boolean fresh, JavaType type,
            Supplier<T> compute) {
        if (!config.enabled()) {
            return compute.get();
        }
        String key = cacheKey(operation, params);
        if (!fresh) {
            Optional<T> hit = read(key, type);
            if (hit.isPresent()) {
                logger.debug("Query cache HIT for {} key={}", operation, shortKey(key));
                return hit.get();
            }
            logger.debug("Query cache MISS for {} key={}", operation, shortKey(key));
        }
        T result = compute.get();
        write(key, result);
        return result;
    }

    private <T> Optional<T> read(String key, JavaType type) {
        Optional<String> json = cacheStore.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OBJECT_MAPPER.readValue(json.get(), type));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable cache entry {}: {}", shortKey(key), e.getOriginalMessage());
            cacheStore.delete(key);
            return Optional.empty();
        }
    }

    private void write(String key, Object result) {
        try {
            cacheStore.set(key, OBJECT_MAPPER.writeValueAsString(result), config.ttl());
        } catch (JsonProcessingException e) {
            logger.warn("Failed to store query result in cache: {}", e.getOriginalMessage());
        }
    }

    /**
     * Computes the cache key for an operation and its parameters.
     *
     * @param params parameters in name order; {@code null} values and empty collections
     *     render as empty
     */
    static String cacheKey(@NotNull String operation, @NotNull Map<String, Object> params) {
        StringBuilder canonical = new StringBuilder(operation);
        new TreeMap<>(params).forEach((name, value) -> {
            canonical.append('|').append(name).append('=');
            if (value instanceof Collection<?>) {
                ((Collection<?>) value).stream().map(String::valueOf).sorted()
                    .forEach(item -> canonical.append(item).append(','));
            } else if (value instanceof Direction) {
                canonical.append(((Direction) value).getValue());
            } else if (value != null) {
                canonical.append(value);
            }
        });
        return KEY_NAMESPACE + ":" + operation + ":" + sha256Hash(canonical.toString());
    }

    private static String shortKey(String key) {
        int hashStart = key.lastIndexOf(':') + 1;
        return key.substring(0, Math.min(key.length(), hashStart + 8));
    }

    private static String sha256Hash(@NotNull String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
