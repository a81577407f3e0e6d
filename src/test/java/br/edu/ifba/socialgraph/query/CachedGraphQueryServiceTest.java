package br.edu.ifba.socialgraph.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.github.benmanes.caffeine.cache.Ticker;

import br.edu.ifba.socialgraph.cache.CacheConfig;
import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.storage.impl.CaffeineCacheStore;

class CachedGraphQueryServiceTest {

    private static final CacheConfig ENABLED = new TestCacheConfig(true, Duration.ofMinutes(5), 100);

    private GraphQueryService delegate;
    private CaffeineCacheStore cacheStore;

    @BeforeEach
    void setUp() {
        delegate = mock(GraphQueryService.class);
        cacheStore = new CaffeineCacheStore(100, Ticker.systemTicker());
    }

    private CachedGraphQueryService service(CacheConfig config) {
        return new CachedGraphQueryService(delegate, cacheStore, config);
    }

    private static GraphStats stats(long nodes) {
        return new GraphStats(nodes, 0, Map.of("github", nodes), Map.of("user", nodes), Map.of(),
            0.0, 0.0, (int) nodes, GraphStats.DegreeSummary.EMPTY);
    }

    @Nested
    @DisplayName("Read-through caching")
    class ReadThrough {

        @Test
        @DisplayName("should serve a repeated query from the cache")
        void testHit() {
            when(delegate.stats()).thenReturn(stats(3));
            CachedGraphQueryService service = service(ENABLED);

            GraphStats first = service.stats(false);
            GraphStats second = service.stats(false);

            assertEquals(first, second);
            assertEquals(3, second.totalNodes());
            verify(delegate, times(1)).stats();
        }

        @Test
        @DisplayName("should bypass the lookup when fresh and refresh the entry")
        void testFresh() {
            when(delegate.stats()).thenReturn(stats(1), stats(2));
            CachedGraphQueryService service = service(ENABLED);

            assertEquals(1, service.stats(false).totalNodes());
            assertEquals(2, service.stats(true).totalNodes());
            assertEquals(2, service.stats(false).totalNodes());
            verify(delegate, times(2)).stats();
        }

        @Test
        @DisplayName("should restore graph records from the cached JSON")
        void testSubgraphRoundTrip() {
            UUID startId = UUID.randomUUID();
            UUID otherId = UUID.randomUUID();
            Instant now = Instant.parse("2024-05-01T10:15:30.123456Z");
            EntityRecord start = new EntityRecord(startId, EntityType.USER, "octocat", SourceType.GITHUB,
                "The Octocat", Map.of("followers", 42), now, now);
            EntityRecord other = new EntityRecord(otherId, EntityType.REPO, "octocat/spoon", SourceType.GITHUB,
                null, null, now, now);
            RelationshipRecord owns = new RelationshipRecord(UUID.randomUUID(), startId, otherId, "owns", 1.0,
                Map.of(), now);
            when(delegate.subgraph(eq(startId), eq(2), eq(10), eq(Direction.BOTH), any()))
                .thenReturn(SubgraphResult.of(List.of(start, other), List.of(owns), false));
            CachedGraphQueryService service = service(ENABLED);

            service.subgraph(startId, 2, 10, Direction.BOTH, List.of(), false);
            SubgraphResult cached = service.subgraph(startId, 2, 10, Direction.BOTH, List.of(), false);

            verify(delegate, times(1)).subgraph(any(), anyInt(), anyInt(), any(), any());
            assertEquals(2, cached.nodeCount());
            assertEquals("The Octocat", cached.nodes().get(0).getDisplayName());
            assertEquals(now, cached.nodes().get(0).getCreatedAt());
            assertEquals("owns", cached.edges().get(0).getRelationshipType());
            assertEquals(otherId, cached.edges().get(0).getTargetNodeId());
        }

        @Test
        @DisplayName("should share entries between equivalent type filters")
        void testTypeOrderIgnored() {
            UUID nodeId = UUID.randomUUID();
            when(delegate.neighbors(any(), any(), anyInt(), any())).thenReturn(List.of());
            CachedGraphQueryService service = service(ENABLED);

            service.neighbors(nodeId, Direction.BOTH, 10, List.of("owns", "follows"), false);
            service.neighbors(nodeId, Direction.BOTH, 10, List.of("follows", "owns"), false);
            service.neighbors(nodeId, Direction.OUTGOING, 10, List.of("follows", "owns"), false);

            verify(delegate, times(2)).neighbors(any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("should recompute when the cached entry cannot be read")
        void testUnreadableEntry() {
            String key = CachedGraphQueryService.cacheKey("stats", Map.of());
            cacheStore.set(key, "{not json", Duration.ofMinutes(5));
            when(delegate.stats()).thenReturn(stats(4));

            assertEquals(4, service(ENABLED).stats(false).totalNodes());
            assertTrue(cacheStore.get(key).orElseThrow().contains("\"total_nodes\":4"));
        }

        @Test
        @DisplayName("should call through when caching is disabled")
        void testDisabled() {
            when(delegate.stats()).thenReturn(stats(1));
            CachedGraphQueryService service = service(new TestCacheConfig(false, Duration.ofMinutes(5), 100));

            service.stats(false);
            service.stats(false);

            verify(delegate, times(2)).stats();
            assertEquals(0, cacheStore.size());
        }
    }

    @Nested
    @DisplayName("Cache keys")
    class Keys {

        @Test
        @DisplayName("should namespace keys by operation and hash the parameters")
        void testFormat() {
            String key = CachedGraphQueryService.cacheKey("path", Map.of("from", "a", "to", "b"));

            assertTrue(key.matches("graph:path:[0-9a-f]{64}"), key);
        }

        @Test
        @DisplayName("should not depend on parameter or collection order")
        void testCanonical() {
            Map<String, Object> first = new TreeMap<>();
            first.put("node", "n1");
            first.put("types", List.of("b", "a"));
            Map<String, Object> second = Map.of("types", List.of("a", "b"), "node", "n1");

            assertEquals(CachedGraphQueryService.cacheKey("neighbors", first),
                CachedGraphQueryService.cacheKey("neighbors", second));
        }

        @Test
        @DisplayName("should differ when any parameter differs")
        void testDistinct() {
            assertNotEquals(CachedGraphQueryService.cacheKey("path", Map.of("max_depth", 5)),
                CachedGraphQueryService.cacheKey("path", Map.of("max_depth", 6)));
            assertNotEquals(CachedGraphQueryService.cacheKey("path", Map.of("max_depth", 5)),
                CachedGraphQueryService.cacheKey("subgraph", Map.of("max_depth", 5)));
        }
    }

    private record TestCacheConfig(boolean enabled, Duration ttl, long maximumSize) implements CacheConfig {
    }
}
