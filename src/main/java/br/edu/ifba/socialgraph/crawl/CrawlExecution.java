package br.edu.ifba.socialgraph.crawl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import br.edu.ifba.socialgraph.core.CrawlJob;
import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.NodeIdentity;
import br.edu.ifba.socialgraph.core.RelationshipRecord;
import br.edu.ifba.socialgraph.source.DiscoveredRelationship;
import br.edu.ifba.socialgraph.source.SourceAdapter;
import br.edu.ifba.socialgraph.source.SourceException;
import br.edu.ifba.socialgraph.storage.GraphStore;

/**
 * Runs one crawl job: resolves the seed, then expands the frontier breadth first in
 * batches of at most {@code concurrencyLimit} entities.
 *
 * <p>Cancellation and the entity cap are checked only between batches. A batch that has
 * started always runs to completion and its writes are kept. Frontier order is FIFO and
 * depth never decreases along it.</p>
 */
final class CrawlExecution implements Runnable {

    private static final Logger LOG = Logger.getLogger(CrawlExecution.class);

    static final String MDC_KEY = "crawl.job";

    /**
     * Receives state transitions. Implemented by the engine, which owns the snapshots.
     */
    interface JobListener {

        /**
         * @return {@code false} when the job is no longer pending and must not run
         */
        boolean started(UUID jobId);

        void progressed(UUID jobId, long entityCount, long edgeCount);

        void completed(UUID jobId);

        void failed(UUID jobId, String errorMessage);

        void cancelled(UUID jobId);
    }

    private record FrontierItem(EntityRecord entity, int depth) {
    }

    private final CrawlJob job;
    private final SourceAdapter adapter;
    private final GraphStore graphStore;
    private final int concurrencyLimit;
    private final Executor fetchExecutor;
    private final JobListener listener;

    private final Set<UUID> touchedNodes = ConcurrentHashMap.newKeySet();
    private final Set<UUID> touchedEdges = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private volatile boolean cancelRequested;

    CrawlExecution(CrawlJob job, SourceAdapter adapter, GraphStore graphStore, int concurrencyLimit,
            Executor fetchExecutor, JobListener listener) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        this.job = job;
        this.adapter = adapter;
        this.graphStore = graphStore;
        this.concurrencyLimit = concurrencyLimit;
        this.fetchExecutor = fetchExecutor;
        this.listener = listener;
    }

    void requestCancel() {
        cancelRequested = true;
    }

    /**
     * Completes once the job reached a terminal state, whatever that state is.
     */
    CompletableFuture<Void> done() {
        return done;
    }

    void markDone() {
        done.complete(null);
    }

    @Override
    public void run() {
        MDC.put(MDC_KEY, job.id().toString());
        try {
            if (!listener.started(job.id())) {
                LOG.debugf("Job %s left the pending state before it was dispatched", job.id());
                return;
            }
            crawl();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Crawl job %s aborted unexpectedly", job.id());
            listener.failed(job.id(), describe(e));
        } finally {
            MDC.remove(MDC_KEY);
            markDone();
        }
    }

    private void crawl() {
        LOG.infof("Crawling %s from '%s' (depth %d, max %d entities)",
            job.source().getValue(), job.startEntity(), job.depth(), job.maxEntities());

        if (cancelRequested) {
            listener.cancelled(job.id());
            return;
        }

        EntityRecord seed;
        try {
            seed = adapter.resolveEntity(job.startEntity());
        } catch (SourceException e) {
            LOG.warnf("Could not resolve start entity '%s': %s", job.startEntity(), e.getMessage());
            listener.failed(job.id(), "Could not resolve start entity '" + job.startEntity() + "': " + e.getMessage());
            return;
        }

        EntityRecord storedSeed;
        try {
            storedSeed = storeNode(seed);
        } catch (CompletionException e) {
            fail("Could not store start entity", e);
            return;
        }
        publishProgress();

        Deque<FrontierItem> frontier = new ArrayDeque<>();
        frontier.add(new FrontierItem(storedSeed, 0));
        Set<NodeIdentity> visited = new HashSet<>();
        visited.add(storedSeed.identity());

        while (!frontier.isEmpty()
                && !cancelRequested
                && touchedNodes.size() < job.maxEntities()
                && frontier.peek().depth() < job.depth()) {

            List<FrontierItem> batch = new ArrayList<>(concurrencyLimit);
            while (batch.size() < concurrencyLimit && !frontier.isEmpty()
                    && frontier.peek().depth() < job.depth()) {
                batch.add(frontier.poll());
            }

            List<CompletableFuture<List<EntityRecord>>> inFlight = new ArrayList<>(batch.size());
            for (FrontierItem item : batch) {
                inFlight.add(CompletableFuture.supplyAsync(withJobContext(() -> expand(item)), fetchExecutor));
            }
            // wait for the whole batch; failures are reported below in batch order
            CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).handle((ignored, e) -> null).join();

            for (int i = 0; i < batch.size(); i++) {
                int nextDepth = batch.get(i).depth() + 1;
                List<EntityRecord> neighbours;
                try {
                    neighbours = inFlight.get(i).get();
                } catch (ExecutionException e) {
                    fail("Failed to expand " + batch.get(i).entity().identity(), e);
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    listener.failed(job.id(), "Crawl interrupted");
                    return;
                }
                for (EntityRecord neighbour : neighbours) {
                    if (visited.add(neighbour.identity()) && nextDepth <= job.depth()) {
                        frontier.add(new FrontierItem(neighbour, nextDepth));
                    }
                }
            }
            publishProgress();
            LOG.debugf("Batch of %d done: %d entities, %d edges, %d queued",
                batch.size(), touchedNodes.size(), touchedEdges.size(), frontier.size());
        }

        if (cancelRequested) {
            LOG.infof("Crawl job %s cancelled after %d entities", job.id(), touchedNodes.size());
            listener.cancelled(job.id());
        } else {
            LOG.infof("Crawl job %s completed: %d entities, %d edges",
                job.id(), touchedNodes.size(), touchedEdges.size());
            listener.completed(job.id());
        }
    }

    /**
     * Fetches the relationships of one entity and stores both endpoints and the edge.
     * Source failures skip the branch; store failures propagate and fail the job.
     */
    private List<EntityRecord> expand(FrontierItem item) {
        EntityRecord entity = item.entity();
        List<DiscoveredRelationship> relationships;
        try {
            relationships = adapter.fetchRelationships(entity);
        } catch (SourceException e) {
            LOG.warnf("Skipping %s: %s", entity.identity(), e.getMessage());
            return List.of();
        } catch (IllegalArgumentException e) {
            LOG.warnf(e, "Skipping %s: unexpected payload", entity.identity());
            return List.of();
        }

        List<EntityRecord> neighbours = new ArrayList<>(relationships.size());
        for (DiscoveredRelationship relationship : relationships) {
            EntityRecord from = storeEndpoint(relationship.from(), entity);
            EntityRecord to = storeEndpoint(relationship.to(), entity);
            RelationshipRecord edge = RelationshipRecord.of(from.getId(), to.getId(),
                relationship.relationshipType(), relationship.weight(), relationship.metadata());
            RelationshipRecord storedEdge = graphStore.upsertEdge(edge).join().record();
            touchedEdges.add(storedEdge.getId());
            neighbours.add(relationship.neighbor() == relationship.from() ? from : to);
        }
        return neighbours;
    }

    private EntityRecord storeEndpoint(EntityRecord endpoint, EntityRecord expanded) {
        if (endpoint == expanded || endpoint.identity().equals(expanded.identity())) {
            return expanded;
        }
        return storeNode(endpoint);
    }

    private EntityRecord storeNode(EntityRecord entity) {
        EntityRecord stored = graphStore.upsertNode(entity).join().record();
        touchedNodes.add(stored.getId());
        return stored;
    }

    private void publishProgress() {
        listener.progressed(job.id(), touchedNodes.size(), touchedEdges.size());
    }

    private void fail(String context, Throwable failure) {
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        LOG.errorf(cause, "%s in crawl job %s", context, job.id());
        publishProgress();
        listener.failed(job.id(), context + ": " + describe(cause));
    }

    private <T> Supplier<T> withJobContext(Supplier<T> task) {
        String jobKey = job.id().toString();
        return () -> {
            MDC.put(MDC_KEY, jobKey);
            try {
                return task.get();
            } finally {
                MDC.remove(MDC_KEY);
            }
        };
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getSimpleName();
    }
}
