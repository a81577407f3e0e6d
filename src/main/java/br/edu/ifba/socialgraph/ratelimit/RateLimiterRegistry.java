package br.edu.ifba.socialgraph.ratelimit;

import java.util.EnumMap;
import java.util.Map;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.source.SourcesConfig;
import br.edu.ifba.socialgraph.source.SourcesConfig.ThrottleConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Holds one {@link TokenBucketRateLimiter} per source, shared by all crawl jobs.
 */
@ApplicationScoped
public class RateLimiterRegistry {

    private static final Logger LOG = Logger.getLogger(RateLimiterRegistry.class);

    private final Map<SourceType, TokenBucketRateLimiter> limiters;

    @Inject
    public RateLimiterRegistry(SourcesConfig config) {
        this.limiters = new EnumMap<>(SourceType.class);
        for (SourceType source : SourceType.values()) {
            ThrottleConfig throttle = config.throttle(source);
            limiters.put(source, new TokenBucketRateLimiter(
                source, throttle.capacity(), throttle.rateLimit(), throttle.maxWait()));
            LOG.infof("Rate limit for %s: %.2f req/s, burst %d, max wait %s",
                source.getValue(), throttle.rateLimit(), throttle.capacity(), throttle.maxWait());
        }
    }

    public RateLimiterRegistry(Map<SourceType, TokenBucketRateLimiter> limiters) {
        this.limiters = new EnumMap<>(limiters);
    }

    /**
     * Blocks until a token for {@code source} is available.
     *
     * @throws RateLimitExceededException if the source's wait budget runs out
     */
    public void acquire(SourceType source) {
        limiterFor(source).acquire();
    }

    public TokenBucketRateLimiter limiterFor(SourceType source) {
        TokenBucketRateLimiter limiter = limiters.get(source);
        if (limiter == null) {
            throw new IllegalArgumentException("No rate limiter registered for " + source);
        }
        return limiter;
    }
}
