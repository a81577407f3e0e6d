package br.edu.ifba.socialgraph.ratelimit;

import java.time.Duration;

import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.source.SourceException;

/**
 * No token became available for a source within the limiter's wait budget.
 */
public class RateLimitExceededException extends SourceException {

    private final Duration maxWait;

    public RateLimitExceededException(SourceType source, Duration maxWait) {
        super(source, "Rate limit for " + source.getValue() + " not satisfied within " + maxWait);
        this.maxWait = maxWait;
    }

    public RateLimitExceededException(SourceType source, Duration maxWait, Throwable cause) {
        super(source, "Interrupted while waiting for a " + source.getValue() + " rate limit token", cause);
        this.maxWait = maxWait;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
