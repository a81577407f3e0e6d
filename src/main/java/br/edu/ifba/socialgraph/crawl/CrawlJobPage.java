package br.edu.ifba.socialgraph.crawl;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import br.edu.ifba.socialgraph.core.CrawlJob;

/**
 * One page of crawl jobs, newest first. {@code page} is 1-based.
 */
public record CrawlJobPage(
    @JsonProperty("jobs") List<CrawlJob> jobs,
    @JsonProperty("total") int total,
    @JsonProperty("page") int page,
    @JsonProperty("page_size") int pageSize
) {
}
