package br.edu.ifba.socialgraph.cache;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Query cache settings, prefix {@code socialgraph.cache}.
 *
 * <pre>
 * socialgraph.cache.enabled=true
 * socialgraph.cache.ttl=1h
 * socialgraph.cache.maximum-size=10000
 * </pre>
 */
@ConfigMapping(prefix = "socialgraph.cache")
public interface CacheConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Fixed time to live of every cached query result. Writes to the graph do not
     * invalidate entries, so this is also the staleness bound.
     */
    @WithDefault("1h")
    Duration ttl();

    @WithName("maximum-size")
    @WithDefault("10000")
    long maximumSize();
}
