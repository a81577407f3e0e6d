package br.edu.ifba.socialgraph.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.core.Direction;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.EntityType;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.exception.ResourceNotFoundException;
import br.edu.ifba.socialgraph.storage.EdgeFilter;
import br.edu.ifba.socialgraph.storage.GraphPage;
import br.edu.ifba.socialgraph.storage.GraphStore;
import br.edu.ifba.socialgraph.storage.NodeFilter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Read-only traversals over the persisted graph.
 *
 * <p>Nothing here writes to the store. Parameter errors surface as
 * {@link IllegalArgumentException}; unknown nodes and unreachable targets as
 * {@link ResourceNotFoundException}.</p>
 */
@ApplicationScoped
public class GraphQueryService {

    private static final Logger LOG = Logger.getLogger(GraphQueryService.class);

    public static final int DEFAULT_DEPTH = 2;
    public static final int MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_NODES = 100;
    public static final int MAX_NODES = 5000;
    public static final int DEFAULT_NEIGHBOR_LIMIT = 50;
    public static final int MAX_NEIGHBOR_LIMIT = 500;
    public static final int DEFAULT_PATH_DEPTH = 5;
    public static final int MAX_PATH_DEPTH = 10;
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 500;
    public static final int DEFAULT_SEARCH_LIMIT = 20;
    public static final int MAX_SEARCH_LIMIT = 100;
    static final int MIN_SEARCH_LENGTH = 2;

    /**
     * (node, hop count) states a single shortest-path search may expand before giving up.
     */
    static final int PATH_EXPLORATION_BUDGET = 10_000;

    private static final int STATS_BATCH_SIZE = 1000;

    /** Weight descending, then creation time ascending, then id. */
    static final Comparator<RelationshipRecord> NEIGHBOR_ORDER = Comparator
        .comparingDouble(RelationshipRecord::getWeight).reversed()
        .thenComparing(RelationshipRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(RelationshipRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<RelationshipRecord> CREATION_ORDER = Comparator
        .comparing(RelationshipRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(RelationshipRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final GraphStore graphStore;

    @Inject
    public GraphQueryService(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    public EntityRecord getNode(UUID nodeId) {
        return graphStore.getNode(nodeId).join()
            .orElseThrow(() -> new ResourceNotFoundException("Node not found: " + nodeId));
    }

    public EntityRecord findNode(SourceType source, EntityType entityType, String entityId) {
        if (source == null || entityType == null || entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("source, type and entity id are required");
        }
        return graphStore.getNodeByIdentity(source, entityType, entityId).join()
            .orElseThrow(() -> new ResourceNotFoundException(
                "Node not found: " + source.getValue() + ":" + entityType.getValue() + ":" + entityId));
    }

    /**
     * Pages through stored nodes in creation order.
     *
     * @param search case-insensitive fragment of the display name, or {@code null}
     */
    public ResultPage<EntityRecord> listNodes(SourceType source, EntityType entityType, String search,
            int page, int pageSize) {
        requirePage(page, pageSize);
        GraphPage<EntityRecord> found = graphStore.findNodes(
            new NodeFilter(source, entityType, search, null), offset(page, pageSize), pageSize).join();
        return ResultPage.of(found.items(), found.total(), page, pageSize);
    }

    /**
     * Nodes whose display name or entity id contains {@code query}, ignoring case.
     */
    public List<EntityRecord> searchNodes(String query, int limit) {
        if (query == null || query.trim().length() < MIN_SEARCH_LENGTH) {
            throw new IllegalArgumentException("q must have at least " + MIN_SEARCH_LENGTH + " characters");
        }
        requireRange("limit", limit, 1, MAX_SEARCH_LIMIT);
        return graphStore.findNodes(NodeFilter.matchingText(query), 0, limit).join().items();
    }

    /**
     * Pages through stored edges in creation order. Every filter is optional.
     */
    public ResultPage<RelationshipRecord> listEdges(String relationshipType, UUID sourceNodeId, UUID targetNodeId,
            Double minWeight, int page, int pageSize) {
        requirePage(page, pageSize);
        if (minWeight != null && (minWeight.isNaN() || minWeight < 0)) {
            throw new IllegalArgumentException("min_weight must not be negative: " + minWeight);
        }
        GraphPage<RelationshipRecord> found = graphStore.findEdges(
            new EdgeFilter(relationshipType, sourceNodeId, targetNodeId, minWeight),
            offset(page, pageSize), pageSize).join();
        return ResultPage.of(found.items(), found.total(), page, pageSize);
    }

    /**
     * Breadth-first traversal from {@code startNodeId}.
     *
     * <p>Nodes are expanded in FIFO order and never past {@code depth} hops. The result never
     * holds more than {@code maxNodes} nodes; an edge is included only when both its ends are.</p>
     *
     * @param relationshipTypes edge types to follow, or empty for all
     */
    public SubgraphResult subgraph(UUID startNodeId, int depth, int maxNodes, Direction direction,
            Collection<String> relationshipTypes) {
        requireRange("depth", depth, 1, MAX_DEPTH);
        requireRange("max_nodes", maxNodes, 1, MAX_NODES);
        Direction effectiveDirection = direction != null ? direction : Direction.BOTH;
        Set<String> types = relationshipTypes == null ? Set.of() : Set.copyOf(relationshipTypes);

        EntityRecord start = getNode(startNodeId);
        Map<UUID, EntityRecord> nodes = new LinkedHashMap<>();
        Map<UUID, RelationshipRecord> edges = new LinkedHashMap<>();
        Map<UUID, Integer> depthOf = new HashMap<>();
        Deque<UUID> frontier = new ArrayDeque<>();
        nodes.put(start.getId(), start);
        depthOf.put(start.getId(), 0);
        frontier.add(start.getId());
        boolean truncated = false;

        while (!frontier.isEmpty()) {
            UUID current = frontier.poll();
            int currentDepth = depthOf.get(current);
            if (currentDepth >= depth) {
                continue;
            }
            List<RelationshipRecord> relationships = graphStore.getEdges(current, effectiveDirection).join().stream()
                .filter(edge -> types.isEmpty() || types.contains(edge.getRelationshipType()))
                .sorted(CREATION_ORDER)
                .collect(Collectors.toList());

            Set<UUID> unseen = new LinkedHashSet<>();
            for (RelationshipRecord edge : relationships) {
                UUID other = edge.otherEnd(current);
                if (!nodes.containsKey(other)) {
                    unseen.add(other);
                }
            }
            Map<UUID, EntityRecord> fetched = unseen.isEmpty()
                ? Map.of()
                : graphStore.getNodes(unseen).join().stream()
                    .collect(Collectors.toMap(EntityRecord::getId, Function.identity()));

            for (RelationshipRecord edge : relationships) {
                UUID other = edge.otherEnd(current);
                if (!nodes.containsKey(other)) {
                    EntityRecord neighbour = fetched.get(other);
                    if (neighbour == null) {
                        continue;
                    }
                    if (nodes.size() >= maxNodes) {
                        truncated = true;
                        continue;
                    }
                    nodes.put(other, neighbour);
                    depthOf.put(other, currentDepth + 1);
                    frontier.add(other);
                }
                edges.putIfAbsent(edge.getId(), edge);
            }
        }

        LOG.debugf("Subgraph from %s: %d nodes, %d edges%s", startNodeId, nodes.size(), edges.size(),
            truncated ? " (truncated)" : "");
        return SubgraphResult.of(new ArrayList<>(nodes.values()), new ArrayList<>(edges.values()), truncated);
    }

    /**
     * Direct edges of a node, heaviest first. Equal weights keep creation order.
     */
    public List<NeighborResult> neighbors(UUID nodeId, Direction direction, int limit,
            Collection<String> relationshipTypes) {
        requireRange("limit", limit, 1, MAX_NEIGHBOR_LIMIT);
        Direction effectiveDirection = direction != null ? direction : Direction.BOTH;
        Set<String> types = relationshipTypes == null ? Set.of() : Set.copyOf(relationshipTypes);
        getNode(nodeId);

        List<RelationshipRecord> relationships = graphStore.getEdges(nodeId, effectiveDirection).join().stream()
            .filter(edge -> types.isEmpty() || types.contains(edge.getRelationshipType()))
            .sorted(NEIGHBOR_ORDER)
            .limit(limit)
            .collect(Collectors.toList());

        Set<UUID> otherIds = relationships.stream()
            .map(edge -> edge.otherEnd(nodeId))
            .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, EntityRecord> others = graphStore.getNodes(otherIds).join().stream()
            .collect(Collectors.toMap(EntityRecord::getId, Function.identity()));

        List<NeighborResult> result = new ArrayList<>(relationships.size());
        for (RelationshipRecord edge : relationships) {
            EntityRecord other = others.get(edge.otherEnd(nodeId));
            if (other != null) {
                Direction side = edge.getSourceNodeId().equals(nodeId) ? Direction.OUTGOING : Direction.INCOMING;
                result.add(new NeighborResult(edge, other, side));
            }
        }
        return result;
    }

    /**
     * Cheapest directed path by summed edge weight, following outgoing edges and at most
     * {@code maxDepth} hops. Equal-cost paths prefer fewer hops.
     *
     * <p>The search runs over (node, hop count) states: a node reached cheaply through many
     * hops does not hide a dearer route to it that leaves more hops for the rest of the path.
     * A state is pruned only when the same node was already settled in no more hops.</p>
     *
     * @throws ResourceNotFoundException when an endpoint is unknown or no path is found
     *     within the hop bound and exploration budget
     */
    public PathResult shortestPath(UUID fromNodeId, UUID toNodeId, int maxDepth) {
        requireRange("max_depth", maxDepth, 1, MAX_PATH_DEPTH);
        EntityRecord from = getNode(fromNodeId);
        getNode(toNodeId);
        if (fromNodeId.equals(toNodeId)) {
            return new PathResult(List.of(from), List.of(), 0, 0.0);
        }

        Map<PathState, Candidate> best = new HashMap<>();
        Map<PathState, PathStep> via = new HashMap<>();
        // node -> fewest hops it has been settled with
        Map<UUID, Integer> settledHops = new HashMap<>();
        PriorityQueue<Candidate> queue = new PriorityQueue<>(Candidate.ORDER);
        Candidate origin = new Candidate(fromNodeId, 0.0, 0);
        best.put(origin.state(), origin);
        queue.add(origin);
        int expanded = 0;

        while (!queue.isEmpty()) {
            Candidate current = queue.poll();
            Integer fewest = settledHops.get(current.nodeId());
            if (fewest != null && fewest <= current.hops()) {
                continue;
            }
            settledHops.put(current.nodeId(), current.hops());
            if (current.nodeId().equals(toNodeId)) {
                return buildPath(from, via, current);
            }
            if (++expanded > PATH_EXPLORATION_BUDGET) {
                LOG.warnf("Shortest path %s -> %s gave up after %d states", fromNodeId, toNodeId, expanded - 1);
                break;
            }
            if (current.hops() >= maxDepth) {
                continue;
            }
            for (RelationshipRecord edge : graphStore.getEdges(current.nodeId(), Direction.OUTGOING).join()) {
                UUID next = edge.getTargetNodeId();
                int nextHops = current.hops() + 1;
                Integer nextFewest = settledHops.get(next);
                if (nextFewest != null && nextFewest <= nextHops) {
                    continue;
                }
                Candidate candidate = new Candidate(next, current.cost() + edge.getWeight(), nextHops);
                Candidate known = best.get(candidate.state());
                if (known == null || Candidate.ORDER.compare(candidate, known) < 0) {
                    best.put(candidate.state(), candidate);
                    via.put(candidate.state(), new PathStep(edge, current.state()));
                    queue.add(candidate);
                }
            }
        }
        throw new ResourceNotFoundException(
            "No path from " + fromNodeId + " to " + toNodeId + " within " + maxDepth + " hops");
    }

    private PathResult buildPath(EntityRecord from, Map<PathState, PathStep> via, Candidate target) {
        List<RelationshipRecord> edges = new ArrayList<>();
        PathState cursor = target.state();
        while (cursor.hops() > 0) {
            PathStep step = via.get(cursor);
            edges.add(step.edge());
            cursor = step.previous();
        }
        Collections.reverse(edges);

        List<UUID> ids = new ArrayList<>(edges.size() + 1);
        ids.add(from.getId());
        edges.forEach(edge -> ids.add(edge.getTargetNodeId()));
        Map<UUID, EntityRecord> byId = graphStore.getNodes(ids).join().stream()
            .collect(Collectors.toMap(EntityRecord::getId, Function.identity()));
        List<EntityRecord> path = ids.stream().map(byId::get).collect(Collectors.toList());
        return new PathResult(path, edges, edges.size(), target.cost());
    }

    /**
     * Aggregates over the whole graph, read in batches. Components treat edges as undirected.
     */
    public GraphStats stats() {
        Map<UUID, Integer> index = new HashMap<>();
        Map<String, Long> bySource = new TreeMap<>();
        Map<String, Long> byType = new TreeMap<>();
        int offset = 0;
        List<EntityRecord> nodeBatch;
        do {
            nodeBatch = graphStore.getNodesBatch(offset, STATS_BATCH_SIZE).join();
            for (EntityRecord node : nodeBatch) {
                if (index.putIfAbsent(node.getId(), index.size()) == null) {
                    bySource.merge(node.getSource().getValue(), 1L, Long::sum);
                    byType.merge(node.getEntityType().getValue(), 1L, Long::sum);
                }
            }
            offset += nodeBatch.size();
        } while (nodeBatch.size() == STATS_BATCH_SIZE);

        int nodeCount = index.size();
        int[] degree = new int[nodeCount];
        DisjointSet components = new DisjointSet(nodeCount);
        Map<String, Long> edgesByType = new TreeMap<>();
        long edgeCount = 0;
        offset = 0;
        List<RelationshipRecord> edgeBatch;
        do {
            edgeBatch = graphStore.getEdgesBatch(offset, STATS_BATCH_SIZE).join();
            for (RelationshipRecord edge : edgeBatch) {
                Integer source = index.get(edge.getSourceNodeId());
                Integer target = index.get(edge.getTargetNodeId());
                if (source == null || target == null) {
                    // written after the node pass
                    continue;
                }
                edgeCount++;
                edgesByType.merge(edge.getRelationshipType(), 1L, Long::sum);
                degree[source]++;
                degree[target]++;
                components.union(source, target);
            }
            offset += edgeBatch.size();
        } while (edgeBatch.size() == STATS_BATCH_SIZE);

        double averageDegree = nodeCount == 0 ? 0.0 : (2.0 * edgeCount) / nodeCount;
        double density = nodeCount < 2 ? 0.0 : edgeCount / (nodeCount * (nodeCount - 1) / 2.0);
        return new GraphStats(nodeCount, edgeCount, bySource, byType, edgesByType,
            averageDegree, density, components.count(), summarize(degree));
    }

    static GraphStats.DegreeSummary summarize(int[] degree) {
        if (degree.length == 0) {
            return GraphStats.DegreeSummary.EMPTY;
        }
        int[] sorted = degree.clone();
        Arrays.sort(sorted);
        long total = 0;
        long isolated = 0;
        for (int value : sorted) {
            total += value;
            if (value == 0) {
                isolated++;
            }
        }
        int middle = sorted.length / 2;
        double median = sorted.length % 2 == 1
            ? sorted[middle]
            : (sorted[middle - 1] + sorted[middle]) / 2.0;
        return new GraphStats.DegreeSummary(sorted[0], sorted[sorted.length - 1],
            (double) total / sorted.length, median, isolated);
    }

    private static void requirePage(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1: " + page);
        }
        requireRange("page_size", pageSize, 1, MAX_PAGE_SIZE);
    }

    private static int offset(int page, int pageSize) {
        long offset = (long) (page - 1) * pageSize;
        if (offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("page is too large: " + page);
        }
        return (int) offset;
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ": " + value);
        }
    }

    private record Candidate(UUID nodeId, double cost, int hops) {

        static final Comparator<Candidate> ORDER = Comparator
            .comparingDouble(Candidate::cost)
            .thenComparingInt(Candidate::hops)
            .thenComparing(Candidate::nodeId);

        PathState state() {
            return new PathState(nodeId, hops);
        }
    }

    private record PathState(UUID nodeId, int hops) {
    }

    private record PathStep(RelationshipRecord edge, PathState previous) {
    }

    /**
     * Union-find with path halving and union by size.
     */
    static final class DisjointSet {

        private final int[] parent;
        private final int[] size;
        private int count;

        DisjointSet(int elements) {
            parent = new int[elements];
            size = new int[elements];
            for (int i = 0; i < elements; i++) {
                parent[i] = i;
                size[i] = 1;
            }
            count = elements;
        }

        int find(int element) {
            int current = element;
            while (parent[current] != current) {
                parent[current] = parent[parent[current]];
                current = parent[current];
            }
            return current;
        }

        void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) {
                return;
            }
            if (size[rootA] < size[rootB]) {
                int swap = rootA;
                rootA = rootB;
                rootB = swap;
            }
            parent[rootB] = rootA;
            size[rootA] += size[rootB];
            count--;
        }

        int count() {
            return count;
        }
    }
}
