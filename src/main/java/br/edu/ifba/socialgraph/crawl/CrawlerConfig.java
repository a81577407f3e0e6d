package br.edu.ifba.socialgraph.crawl;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Engine-wide crawl limits. Per-request depth and entity caps are clamped to these ceilings.
 */
@ConfigMapping(prefix = "socialgraph.crawler")
public interface CrawlerConfig {

    @WithDefault("3")
    int maxCrawlDepth();

    @WithDefault("1000")
    int maxNodesPerJob();

    /**
     * Frontier items expanded concurrently inside one job.
     */
    @WithDefault("10")
    int concurrencyLimit();

    /**
     * Jobs running at the same time. Further jobs wait as {@code pending}.
     */
    @WithDefault("4")
    int maxConcurrentJobs();

    /**
     * How long finished jobs stay visible to pollers.
     */
    @WithDefault("24h")
    Duration jobRetention();

    /**
     * How often finished jobs are pruned.
     */
    @WithDefault("10m")
    Duration reaperInterval();
}
