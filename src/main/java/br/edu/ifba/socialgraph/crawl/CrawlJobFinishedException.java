package br.edu.ifba.socialgraph.crawl;

import java.util.UUID;

import br.edu.ifba.socialgraph.core.CrawlStatus;

/**
 * Thrown when an operation needs a live job but the job already reached a terminal state.
 */
public class CrawlJobFinishedException extends RuntimeException {

    private final UUID jobId;
    private final CrawlStatus status;

    public CrawlJobFinishedException(UUID jobId, CrawlStatus status) {
        super("Crawl job " + jobId + " already finished with status " + status.getValue());
        this.jobId = jobId;
        this.status = status;
    }

    public UUID getJobId() {
        return jobId;
    }

    public CrawlStatus getStatus() {
        return status;
    }
}
