package br.edu.ifba.socialgraph.crawl;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.core.CrawlJob;
import br.edu.ifba.socialgraph.core.CrawlStatus;
import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.exception.ResourceNotFoundException;
import br.edu.ifba.socialgraph.shared.MonotonicClock;
import br.edu.ifba.socialgraph.shared.UuidUtils;
import br.edu.ifba.socialgraph.source.SourceAdapter;
import br.edu.ifba.socialgraph.source.SourceAdapterRegistry;
import br.edu.ifba.socialgraph.storage.GraphStore;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Starts, tracks and cancels crawl jobs.
 *
 * <p>The engine owns every job snapshot. Executions report transitions back through
 * {@link CrawlExecution.JobListener}; each transition is an atomic replace of the
 * snapshot, and terminal snapshots are never replaced. Callers only hold job ids.</p>
 *
 * <p>Jobs run on a bounded pool of {@code max-concurrent-jobs} threads. Entity expansion
 * inside a job runs on a separate shared pool so one job can keep up to
 * {@code concurrency-limit} source calls in flight.</p>
 */
@ApplicationScoped
public class CrawlEngine implements CrawlExecution.JobListener {

    private static final Logger LOG = Logger.getLogger(CrawlEngine.class);

    private final SourceAdapterRegistry adapters;
    private final GraphStore graphStore;
    private final CrawlerConfig config;
    private final MonotonicClock clock;

    private final Map<UUID, CrawlJob> jobs = new ConcurrentHashMap<>();
    private final Map<UUID, CrawlExecution> executions = new ConcurrentHashMap<>();

    private final ExecutorService jobExecutor;
    private final ExecutorService fetchExecutor;

    @Inject
    public CrawlEngine(SourceAdapterRegistry adapters, GraphStore graphStore, CrawlerConfig config) {
        this(adapters, graphStore, config, new MonotonicClock());
    }

    public CrawlEngine(SourceAdapterRegistry adapters, GraphStore graphStore, CrawlerConfig config,
            MonotonicClock clock) {
        this.adapters = adapters;
        this.graphStore = graphStore;
        this.config = config;
        this.clock = clock;
        int jobThreads = Math.max(1, config.maxConcurrentJobs());
        this.jobExecutor = new ThreadPoolExecutor(jobThreads, jobThreads, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), namedThreads("crawl-job"));
        this.fetchExecutor = Executors.newCachedThreadPool(namedThreads("crawl-fetch"));
    }

    /**
     * Registers a pending job and queues it for execution.
     *
     * @throws IllegalArgumentException when the parameters are out of range or no adapter
     *     serves the source
     */
    public CrawlJob startCrawl(SourceType source, String startEntity, int depth, int maxEntities) {
        if (source == null) {
            throw new IllegalArgumentException("source is required");
        }
        if (startEntity == null || startEntity.isBlank()) {
            throw new IllegalArgumentException("start_entity is required");
        }
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1");
        }
        if (maxEntities < 1) {
            throw new IllegalArgumentException("max_entities must be at least 1");
        }
        SourceAdapter adapter = adapters.forSource(source);

        int effectiveDepth = Math.min(depth, config.maxCrawlDepth());
        int effectiveMax = Math.min(maxEntities, config.maxNodesPerJob());
        if (effectiveDepth != depth || effectiveMax != maxEntities) {
            LOG.infof("Clamped crawl request to depth %d and %d entities", effectiveDepth, effectiveMax);
        }

        CrawlJob job = CrawlJob.pending(UuidUtils.randomV7(), source, startEntity.trim(),
            effectiveDepth, effectiveMax, clock.now());
        CrawlExecution execution = new CrawlExecution(job, adapter, graphStore,
            config.concurrencyLimit(), fetchExecutor, this);
        jobs.put(job.id(), job);
        executions.put(job.id(), execution);

        try {
            jobExecutor.execute(execution);
        } catch (RejectedExecutionException e) {
            LOG.errorf(e, "Could not schedule crawl job %s", job.id());
            failed(job.id(), "Crawl engine is shutting down");
        }
        LOG.infof("Queued crawl job %s for %s '%s'", job.id(), source.getValue(), job.startEntity());
        return jobs.get(job.id());
    }

    /**
     * @throws ResourceNotFoundException when the id is unknown
     */
    public CrawlJob getCrawlJob(UUID jobId) {
        CrawlJob job = jobs.get(jobId);
        if (job == null) {
            throw new ResourceNotFoundException("Crawl job not found: " + jobId);
        }
        return job;
    }

    /**
     * Requests cancellation. A pending job is cancelled at once. A running job keeps its
     * current batch and turns {@code cancelled} at the next batch boundary, so the returned
     * snapshot may still read {@code running}.
     *
     * @throws ResourceNotFoundException when the id is unknown
     * @throws CrawlJobFinishedException when the job already finished
     */
    public CrawlJob cancelCrawl(UUID jobId) {
        CrawlJob current = getCrawlJob(jobId);
        if (current.isFinished()) {
            throw new CrawlJobFinishedException(jobId, current.status());
        }
        CrawlExecution execution = executions.get(jobId);
        if (execution != null) {
            execution.requestCancel();
        }
        CrawlJob updated = jobs.computeIfPresent(jobId, (id, job) ->
            job.status() == CrawlStatus.PENDING ? job.cancelled(clock.now()) : job);
        if (updated != null && updated.status() == CrawlStatus.CANCELLED) {
            release(jobId);
        } else if (updated != null && updated.isFinished()) {
            throw new CrawlJobFinishedException(jobId, updated.status());
        }
        LOG.infof("Cancellation requested for crawl job %s", jobId);
        return updated;
    }

    /**
     * Jobs newest first, optionally filtered.
     *
     * @param page 1-based page number
     */
    public CrawlJobPage listCrawlJobs(SourceType source, CrawlStatus status, int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (pageSize < 1 || pageSize > 100) {
            throw new IllegalArgumentException("page_size must be between 1 and 100");
        }
        List<CrawlJob> matching = jobs.values().stream()
            .filter(job -> source == null || job.source() == source)
            .filter(job -> status == null || job.status() == status)
            .sorted(Comparator.comparing(CrawlJob::createdAt).reversed()
                .thenComparing(CrawlJob::id, Comparator.reverseOrder()))
            .collect(Collectors.toList());
        int from = (int) Math.min((long) (page - 1) * pageSize, matching.size());
        int to = Math.min(from + pageSize, matching.size());
        return new CrawlJobPage(List.copyOf(matching.subList(from, to)), matching.size(), page, pageSize);
    }

    /**
     * Waits until the job finishes or the timeout passes, then returns the latest snapshot.
     */
    public CrawlJob awaitCrawlJob(UUID jobId, Duration timeout) {
        CrawlJob current = getCrawlJob(jobId);
        CrawlExecution execution = executions.get(jobId);
        if (current.isFinished() || execution == null) {
            return getCrawlJob(jobId);
        }
        try {
            execution.done().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.debugf("Crawl job %s still %s after %s", jobId, getCrawlJob(jobId).status().getValue(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LOG.warnf(e.getCause(), "Crawl job %s ended abnormally", jobId);
        }
        return getCrawlJob(jobId);
    }

    /**
     * Forgets finished jobs that completed before {@code cutoff}.
     *
     * @return number of jobs removed
     */
    public int pruneFinishedJobs(Instant cutoff) {
        int before = jobs.size();
        jobs.values().removeIf(job -> job.isFinished()
            && job.completedAt() != null
            && job.completedAt().isBefore(cutoff));
        return before - jobs.size();
    }

    // ===== JobListener =====

    @Override
    public boolean started(UUID jobId) {
        CrawlJob updated = jobs.computeIfPresent(jobId, (id, job) ->
            job.status() == CrawlStatus.PENDING ? job.running(clock.now()) : job);
        return updated != null && updated.status() == CrawlStatus.RUNNING;
    }

    @Override
    public void progressed(UUID jobId, long entityCount, long edgeCount) {
        jobs.computeIfPresent(jobId, (id, job) ->
            job.status() == CrawlStatus.RUNNING ? job.withProgress(entityCount, edgeCount) : job);
    }

    @Override
    public void completed(UUID jobId) {
        finish(jobId, job -> job.completed(clock.now()));
    }

    @Override
    public void failed(UUID jobId, String errorMessage) {
        finish(jobId, job -> job.failed(errorMessage, clock.now()));
    }

    @Override
    public void cancelled(UUID jobId) {
        finish(jobId, job -> job.cancelled(clock.now()));
    }

    private void finish(UUID jobId, UnaryOperator<CrawlJob> transition) {
        jobs.computeIfPresent(jobId, (id, job) -> job.isFinished() ? job : transition.apply(job));
        release(jobId);
    }

    private void release(UUID jobId) {
        CrawlExecution execution = executions.remove(jobId);
        if (execution != null) {
            execution.markDone();
        }
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down crawl engine");
        executions.values().forEach(CrawlExecution::requestCancel);
        jobExecutor.shutdown();
        fetchExecutor.shutdown();
        try {
            if (!jobExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            jobExecutor.shutdownNow();
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
