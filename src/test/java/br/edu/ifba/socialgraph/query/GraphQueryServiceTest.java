package br.edu.ifba.socialgraph.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.exception.ResourceNotFoundException;
import br.edu.ifba.socialgraph.storage.impl.InMemoryGraphStore;

class GraphQueryServiceTest {

    private InMemoryGraphStore graphStore;
    private GraphQueryService service;

    @BeforeEach
    void setUp() {
        graphStore = new InMemoryGraphStore();
        graphStore.initialize().join();
        service = new GraphQueryService(graphStore);
    }

    @AfterEach
    void tearDown() {
        graphStore.close();
    }

    private EntityRecord node(String id) {
        return node(SourceType.GITHUB, EntityType.USER, id);
    }

    private EntityRecord node(SourceType source, EntityType type, String id) {
        EntityRecord entity = EntityRecord.builder()
            .source(source)
            .entityType(type)
            .entityId(id)
            .displayName(id)
            .build();
        return graphStore.upsertNode(entity).join().record();
    }

    private RelationshipRecord edge(EntityRecord from, EntityRecord to, String type, double weight) {
        return graphStore.upsertEdge(RelationshipRecord.of(from.getId(), to.getId(), type, weight, Map.of()))
            .join().record();
    }

    private static Set<String> entityIds(List<EntityRecord> nodes) {
        return nodes.stream().map(EntityRecord::getEntityId).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Browsing")
    class Browsing {

        @Test
        @DisplayName("should page nodes and count pages from the filtered total")
        void testListNodes() {
            for (int i = 0; i < 5; i++) {
                node("user-" + i);
            }
            node(SourceType.REDDIT, EntityType.COMMUNITY, "java");

            ResultPage<EntityRecord> page = service.listNodes(SourceType.GITHUB, null, null, 2, 2);

            assertEquals(5, page.total());
            assertEquals(3, page.pages());
            assertEquals(List.of("user-2", "user-3"), page.items().stream()
                .map(EntityRecord::getEntityId).collect(Collectors.toList()));
            assertEquals(Set.of("java"), entityIds(service.listNodes(null, null, "JAV", 1, 50).items()));
        }

        @Test
        @DisplayName("should search display names and entity ids")
        void testSearchNodes() {
            node("octocat");
            node(SourceType.WIKIPEDIA, EntityType.PAGE, "Octopus");
            node("torvalds");

            assertEquals(Set.of("octocat", "Octopus"), entityIds(service.searchNodes("oct", 20)));
            assertEquals(1, service.searchNodes("oct", 1).size());
            assertThrows(IllegalArgumentException.class, () -> service.searchNodes(" o ", 20));
            assertThrows(IllegalArgumentException.class, () -> service.searchNodes("oct", 101));
        }

        @Test
        @DisplayName("should filter edges by endpoint and weight")
        void testListEdges() {
            EntityRecord a = node("a");
            EntityRecord b = node("b");
            EntityRecord c = node("c");
            edge(a, b, "follows", 0.9);
            edge(a, c, "follows", 0.1);
            edge(b, c, "owns", 1.0);

            ResultPage<RelationshipRecord> heavy = service.listEdges(null, a.getId(), null, 0.5, 1, 50);

            assertEquals(1, heavy.total());
            assertEquals(b.getId(), heavy.items().get(0).getTargetNodeId());
            assertEquals(1, service.listEdges("owns", null, null, null, 1, 50).total());
            assertEquals(1, service.listEdges(null, null, null, null, 1, 50).pages());
            assertThrows(IllegalArgumentException.class, () -> service.listEdges(null, null, null, -0.1, 1, 50));
            assertThrows(IllegalArgumentException.class, () -> service.listEdges(null, null, null, null, 0, 50));
            assertThrows(IllegalArgumentException.class, () -> service.listEdges(null, null, null, null, 1, 501));
        }
    }

    @Nested
    @DisplayName("Subgraph traversal")
    class Subgraph {

        private EntityRecord root;

        /** root, 3 children c<i>, 9 grandchildren g<i><j>, 27 great-grandchildren x<i><j><k>. */
        @BeforeEach
        void buildTree() {
            root = node("root");
            for (int i = 0; i < 3; i++) {
                EntityRecord child = node("c" + i);
                edge(root, child, "follows", 1.0);
                for (int j = 0; j < 3; j++) {
                    EntityRecord grandchild = node("g" + i + j);
                    edge(child, grandchild, "follows", 1.0);
                    for (int k = 0; k < 3; k++) {
                        edge(grandchild, node("x" + i + j + k), "owns", 1.0);
                    }
                }
            }
        }

        @Test
        @DisplayName("should return exactly max_nodes nodes and nothing past the depth")
        void testCapAndDepth() {
            SubgraphResult result = service.subgraph(root.getId(), 2, 10, Direction.BOTH, List.of());

            assertEquals(10, result.nodeCount());
            assertTrue(result.truncated());
            assertTrue(entityIds(result.nodes()).stream().noneMatch(id -> id.startsWith("x")));
            assertEquals(Set.of("root", "c0", "c1", "c2", "g00", "g01", "g02", "g10", "g11", "g12"),
                entityIds(result.nodes()));
            Set<UUID> included = result.nodes().stream().map(EntityRecord::getId).collect(Collectors.toSet());
            assertTrue(result.edges().stream().allMatch(e ->
                included.contains(e.getSourceNodeId()) && included.contains(e.getTargetNodeId())));
            assertEquals(9, result.edgeCount());
        }

        @Test
        @DisplayName("should return the whole neighbourhood when the cap is not reached")
        void testUncapped() {
            SubgraphResult result = service.subgraph(root.getId(), 2, 100, Direction.BOTH, null);

            assertEquals(13, result.nodeCount());
            assertEquals(12, result.edgeCount());
            assertFalse(result.truncated());
            assertEquals("root", result.nodes().get(0).getEntityId());
        }

        @Test
        @DisplayName("should follow only the requested direction and edge types")
        void testDirectionAndTypes() {
            EntityRecord g00 = graphStore.getNodeByIdentity(SourceType.GITHUB, EntityType.USER, "g00").join().orElseThrow();

            assertEquals(Set.of("g00", "x000", "x001", "x002"),
                entityIds(service.subgraph(g00.getId(), 1, 100, Direction.OUTGOING, List.of()).nodes()));
            assertEquals(Set.of("g00", "c0"),
                entityIds(service.subgraph(g00.getId(), 1, 100, Direction.INCOMING, List.of()).nodes()));
            assertEquals(Set.of("g00", "c0"),
                entityIds(service.subgraph(g00.getId(), 1, 100, Direction.BOTH, List.of("follows")).nodes()));
        }

        @Test
        @DisplayName("should validate parameters and the start node")
        void testValidation() {
            assertThrows(IllegalArgumentException.class,
                () -> service.subgraph(root.getId(), 0, 10, Direction.BOTH, List.of()));
            assertThrows(IllegalArgumentException.class,
                () -> service.subgraph(root.getId(), 6, 10, Direction.BOTH, List.of()));
            assertThrows(IllegalArgumentException.class,
                () -> service.subgraph(root.getId(), 2, 0, Direction.BOTH, List.of()));
            assertThrows(ResourceNotFoundException.class,
                () -> service.subgraph(UUID.randomUUID(), 2, 10, Direction.BOTH, List.of()));
        }
    }

    @Nested
    @DisplayName("Neighbours")
    class Neighbors {

        @Test
        @DisplayName("should order by weight and keep creation order between equal weights")
        void testOrdering() {
            EntityRecord hub = node("hub");
            EntityRecord a = node("a");
            EntityRecord b = node("b");
            EntityRecord c = node("c");
            edge(hub, a, "follows", 0.9);
            edge(hub, b, "follows", 0.5);
            edge(hub, c, "follows", 0.9);

            List<NeighborResult> result = service.neighbors(hub.getId(), Direction.BOTH, 50, List.of());

            assertEquals(List.of("a", "c", "b"), result.stream()
                .map(n -> n.node().getEntityId()).collect(Collectors.toList()));
            assertTrue(result.stream().allMatch(n -> n.direction() == Direction.OUTGOING));
            assertEquals(List.of("a", "c"), service.neighbors(hub.getId(), Direction.BOTH, 2, List.of()).stream()
                .map(n -> n.node().getEntityId()).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("should tag incoming edges and filter by direction")
        void testDirections() {
            EntityRecord hub = node("hub");
            EntityRecord follower = node("follower");
            EntityRecord repo = node(SourceType.GITHUB, EntityType.REPO, "hub/repo");
            edge(follower, hub, "follows", 1.0);
            edge(hub, repo, "owns", 1.0);

            List<NeighborResult> incoming = service.neighbors(hub.getId(), Direction.INCOMING, 50, null);
            List<NeighborResult> owns = service.neighbors(hub.getId(), Direction.BOTH, 50, List.of("owns"));

            assertEquals(1, incoming.size());
            assertEquals("follower", incoming.get(0).node().getEntityId());
            assertEquals(Direction.INCOMING, incoming.get(0).direction());
            assertEquals(1, owns.size());
            assertEquals("hub/repo", owns.get(0).node().getEntityId());
        }

        @Test
        @DisplayName("should fail for unknown nodes")
        void testUnknownNode() {
            assertThrows(ResourceNotFoundException.class,
                () -> service.neighbors(UUID.randomUUID(), Direction.BOTH, 10, List.of()));
        }
    }

    @Nested
    @DisplayName("Shortest path")
    class ShortestPath {

        private EntityRecord a;
        private EntityRecord b;
        private EntityRecord c;
        private EntityRecord d;
        private EntityRecord e;

        @BeforeEach
        void buildGraph() {
            a = node("a");
            b = node("b");
            c = node("c");
            d = node("d");
            e = node("e");
            edge(a, b, "follows", 1.0);
            edge(b, d, "follows", 1.0);
            edge(a, c, "follows", 0.2);
            edge(c, e, "follows", 0.2);
            edge(e, d, "follows", 0.2);
        }

        @Test
        @DisplayName("should prefer the lighter path over the shorter one")
        void testWeighted() {
            PathResult path = service.shortestPath(a.getId(), d.getId(), 5);

            assertEquals(List.of("a", "c", "e", "d"), path.path().stream()
                .map(EntityRecord::getEntityId).collect(Collectors.toList()));
            assertEquals(3, path.length());
            assertEquals(3, path.edges().size());
            assertEquals(0.6, path.totalWeight(), 1e-9);
        }

        @Test
        @DisplayName("should respect the hop bound")
        void testHopBound() {
            PathResult path = service.shortestPath(a.getId(), d.getId(), 2);

            assertEquals(List.of("a", "b", "d"), path.path().stream()
                .map(EntityRecord::getEntityId).collect(Collectors.toList()));
            assertEquals(2.0, path.totalWeight(), 1e-9);
            assertThrows(ResourceNotFoundException.class, () -> service.shortestPath(a.getId(), d.getId(), 1));
        }

        @Test
        @DisplayName("should take a dearer route to a node when the cheaper one uses up the hop bound")
        void testCheapLongDetourDoesNotHideShortRoute() {
            EntityRecord x = node("x");
            EntityRecord t = node("t");
            edge(a, x, "follows", 0.1);
            edge(x, b, "follows", 0.1);
            edge(b, t, "follows", 1.0);

            // a-x-b costs 0.2 but leaves no hop for b-t within two hops
            PathResult path = service.shortestPath(a.getId(), t.getId(), 2);

            assertEquals(List.of("a", "b", "t"), path.path().stream()
                .map(EntityRecord::getEntityId).collect(Collectors.toList()));
            assertEquals(2, path.length());
            assertEquals(2.0, path.totalWeight(), 1e-9);

            PathResult unbounded = service.shortestPath(a.getId(), t.getId(), 5);
            assertEquals(List.of("a", "x", "b", "t"), unbounded.path().stream()
                .map(EntityRecord::getEntityId).collect(Collectors.toList()));
            assertEquals(1.2, unbounded.totalWeight(), 1e-9);
        }

        @Test
        @DisplayName("should return a single node path from a node to itself")
        void testSameNode() {
            PathResult path = service.shortestPath(a.getId(), a.getId(), 5);

            assertEquals(0, path.length());
            assertEquals(List.of(a.getId()), path.path().stream().map(EntityRecord::getId).collect(Collectors.toList()));
            assertTrue(path.edges().isEmpty());
        }

        @Test
        @DisplayName("should follow edges in their direction only")
        void testDirected() {
            EntityRecord isolated = node("isolated");

            assertThrows(ResourceNotFoundException.class, () -> service.shortestPath(d.getId(), a.getId(), 5));
            assertThrows(ResourceNotFoundException.class, () -> service.shortestPath(a.getId(), isolated.getId(), 5));
            assertThrows(ResourceNotFoundException.class, () -> service.shortestPath(a.getId(), UUID.randomUUID(), 5));
            assertThrows(IllegalArgumentException.class, () -> service.shortestPath(a.getId(), d.getId(), 11));
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Stats {

        @Test
        @DisplayName("should summarize counts, degrees and components")
        void testStats() {
            EntityRecord g1 = node("g1");
            EntityRecord g2 = node("g2");
            EntityRecord g3 = node("g3");
            EntityRecord community = node(SourceType.REDDIT, EntityType.COMMUNITY, "java");
            EntityRecord poster = node(SourceType.REDDIT, EntityType.USER, "alice");
            node(SourceType.WIKIPEDIA, EntityType.PAGE, "12401");
            edge(g1, g2, "follows", 1.0);
            edge(g2, g3, "follows", 1.0);
            edge(poster, community, "posts_in", 0.5);

            GraphStats stats = service.stats();

            assertEquals(6, stats.totalNodes());
            assertEquals(3, stats.totalEdges());
            assertEquals(Map.of("github", 3L, "reddit", 2L, "wikipedia", 1L), stats.nodesBySource());
            assertEquals(Map.of("user", 4L, "community", 1L, "page", 1L), stats.nodesByType());
            assertEquals(Map.of("follows", 2L, "posts_in", 1L), stats.edgesByType());
            assertEquals(1.0, stats.averageDegree(), 1e-9);
            assertEquals(0.2, stats.density(), 1e-9);
            assertEquals(3, stats.connectedComponents());
            assertEquals(new GraphStats.DegreeSummary(0, 2, 1.0, 1.0, 1), stats.degree());
        }

        @Test
        @DisplayName("should report an empty graph")
        void testEmpty() {
            GraphStats stats = service.stats();

            assertEquals(0, stats.totalNodes());
            assertEquals(0, stats.connectedComponents());
            assertEquals(GraphStats.DegreeSummary.EMPTY, stats.degree());
        }

        @Test
        @DisplayName("should average the middle degrees for an even count")
        void testMedian() {
            GraphStats.DegreeSummary summary = GraphQueryService.summarize(new int[] {4, 1, 3, 0});

            assertEquals(0, summary.min());
            assertEquals(4, summary.max());
            assertEquals(2.0, summary.mean(), 1e-9);
            assertEquals(2.0, summary.median(), 1e-9);
            assertEquals(1, summary.isolatedNodes());
        }
    }
}
