package br.edu.ifba.socialgraph.source;

import java.time.temporal.ChronoUnit;
import java.util.function.Supplier;

import org.eclipse.microprofile.faulttolerance.Retry;

import br.edu.ifba.socialgraph.core.SourceType;
import br.edu.ifba.socialgraph.ratelimit.RateLimiterRegistry;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Single choke point for outbound source requests: every attempt takes a rate limit
 * token first, and transient failures are retried with exponential backoff.
 *
 * <p>Retry settings can be overridden with MicroProfile Fault Tolerance config keys, e.g.
 * {@code br.edu.ifba.socialgraph.source.SourceGateway/execute/Retry/maxRetries=5}.</p>
 */
@ApplicationScoped
public class SourceGateway {

    public static final int MAX_ATTEMPTS = 4;

    private final RateLimiterRegistry rateLimiters;

    @Inject
    public SourceGateway(RateLimiterRegistry rateLimiters) {
        this.rateLimiters = rateLimiters;
    }

    @Retry(maxRetries = MAX_ATTEMPTS - 1, delay = 500, delayUnit = ChronoUnit.MILLIS,
        maxDuration = 120, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(maxDelay = 30, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientSourceErrorPredicate.class)
    public <T> T execute(SourceType source, Supplier<T> request) {
        rateLimiters.acquire(source);
        return request.get();
    }
}
