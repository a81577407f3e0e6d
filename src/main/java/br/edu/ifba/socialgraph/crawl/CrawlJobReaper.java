package br.edu.ifba.socialgraph.crawl;

import java.time.Instant;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Drops finished jobs once they are older than {@code socialgraph.crawler.job-retention}.
 */
@ApplicationScoped
public class CrawlJobReaper {

    private static final Logger LOG = Logger.getLogger(CrawlJobReaper.class);

    @Inject
    CrawlEngine crawlEngine;

    @Inject
    CrawlerConfig config;

    @Scheduled(every = "{socialgraph.crawler.reaper-interval}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pruneFinishedJobs() {
        Instant cutoff = Instant.now().minus(config.jobRetention());
        int removed = crawlEngine.pruneFinishedJobs(cutoff);
        if (removed > 0) {
            LOG.infof("Removed %d finished crawl jobs older than %s", removed, cutoff);
        }
    }
}
