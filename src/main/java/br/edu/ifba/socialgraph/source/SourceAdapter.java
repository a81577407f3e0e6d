package br.edu.ifba.socialgraph.source;

import java.util.List;

import org.jetbrains.annotations.NotNull;

import br.edu.ifba.socialgraph.core.EntityRecord;
import br.edu.ifba.socialgraph.core.SourceType;

/**
 * Turns one external network into normalized graph records.
 *
 * <p>Every outbound request an implementation makes is rate limited for its source and
 * retried on transient failures before an error is surfaced, so callers must not retry
 * on their own. Implementations keep no mutable state and are shared by all crawl jobs.</p>
 *
 * <p>Implementations: GitHubSourceAdapter, RedditSourceAdapter, WikipediaSourceAdapter</p>
 */
public interface SourceAdapter {

    SourceType source();

    /**
     * Resolves a user supplied reference (login, {@code owner/repo}, {@code r/name},
     * page title...) to the entity it names.
     *
     * @throws EntityNotFoundException if the source does not know it or the payload cannot be normalized
     * @throws SourceUnavailableException if the source keeps failing
     * @throws br.edu.ifba.socialgraph.ratelimit.RateLimitExceededException if no request slot frees up in time
     */
    @NotNull
    EntityRecord resolveEntity(@NotNull String reference);

    /**
     * Lists the direct neighbours of an entity previously returned by this adapter.
     * Entity types the source cannot expand yield an empty list.
     *
     * @throws SourceException on the same conditions as {@link #resolveEntity(String)}
     */
    @NotNull
    List<DiscoveredRelationship> fetchRelationships(@NotNull EntityRecord entity);
}
