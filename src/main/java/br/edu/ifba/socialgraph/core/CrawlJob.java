package br.edu.ifba.socialgraph.core;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of a crawl job as seen by pollers.
 *
 * <p>Counters only grow while the job runs. {@code errorMessage} is set only for
 * {@link CrawlStatus#FAILED}. Terminal snapshots never change again.</p>
 */
public record CrawlJob(
    @JsonProperty("id") UUID id,
    @JsonProperty("source") SourceType source,
    @JsonProperty("start_entity") String startEntity,
    @JsonProperty("depth") int depth,
    @JsonProperty("max_entities") int maxEntities,
    @JsonProperty("status") CrawlStatus status,
    @JsonProperty("entity_count") long entityCount,
    @JsonProperty("edge_count") long edgeCount,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt,
    @JsonProperty("created_at") Instant createdAt
) {

    public static CrawlJob pending(UUID id, SourceType source, String startEntity, int depth,
            int maxEntities, Instant createdAt) {
        return new CrawlJob(id, source, startEntity, depth, maxEntities, CrawlStatus.PENDING,
            0, 0, null, null, null, createdAt);
    }

    public CrawlJob running(Instant now) {
        requireStatus(CrawlStatus.PENDING);
        return new CrawlJob(id, source, startEntity, depth, maxEntities, CrawlStatus.RUNNING,
            entityCount, edgeCount, null, now, null, createdAt);
    }

    /**
     * Publishes new counters. Lower values than the current ones are ignored.
     */
    public CrawlJob withProgress(long entities, long edges) {
        requireStatus(CrawlStatus.RUNNING);
        return new CrawlJob(id, source, startEntity, depth, maxEntities, status,
            Math.max(entityCount, entities), Math.max(edgeCount, edges), null, startedAt, null, createdAt);
    }

    public CrawlJob completed(Instant now) {
        requireStatus(CrawlStatus.RUNNING);
        return finish(CrawlStatus.COMPLETED, null, now);
    }

    public CrawlJob failed(String message, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.getValue());
        }
        return finish(CrawlStatus.FAILED, message != null ? message : "Crawl failed", now);
    }

    public CrawlJob cancelled(Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job " + id + " is already " + status.getValue());
        }
        return finish(CrawlStatus.CANCELLED, null, now);
    }

    @JsonProperty("duration_seconds")
    public Double durationSeconds() {
        if (startedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }

    @JsonIgnore
    public boolean isFinished() {
        return status.isTerminal();
    }

    private CrawlJob finish(CrawlStatus terminal, String message, Instant now) {
        return new CrawlJob(id, source, startEntity, depth, maxEntities, terminal,
            entityCount, edgeCount, message, startedAt, now, createdAt);
    }

    private void requireStatus(CrawlStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                "Job " + id + " is " + status.getValue() + ", expected " + expected.getValue());
        }
    }
}
