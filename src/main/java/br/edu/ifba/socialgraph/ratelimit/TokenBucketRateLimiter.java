package br.edu.ifba.socialgraph.ratelimit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.core.SourceType;

/**
 * Token bucket guarding outbound calls to one source.
 *
 * <p>The bucket starts full with {@code capacity} tokens and refills continuously at
 * {@code refillPerSecond}. Over any window of {@code T} seconds at most
 * {@code capacity + T * refillPerSecond} acquisitions succeed. Callers that find the
 * bucket empty sleep outside the lock until the next token is due, and give up with
 * {@link RateLimitExceededException} once {@code maxWait} would be exceeded.</p>
 */
public final class TokenBucketRateLimiter {

    private static final Logger LOG = Logger.getLogger(TokenBucketRateLimiter.class);

    private final SourceType source;
    private final double capacity;
    private final double refillPerSecond;
    private final Duration maxWait;
    private final TimeSource timeSource;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(SourceType source, double capacity, double refillPerSecond, Duration maxWait) {
        this(source, capacity, refillPerSecond, maxWait, TimeSource.SYSTEM);
    }

    public TokenBucketRateLimiter(SourceType source, double capacity, double refillPerSecond,
            Duration maxWait, TimeSource timeSource) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        if (refillPerSecond <= 0) {
            throw new IllegalArgumentException("refillPerSecond must be positive");
        }
        if (maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be negative");
        }
        this.source = source;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.maxWait = maxWait;
        this.timeSource = timeSource;
        this.tokens = capacity;
        this.lastRefillNanos = timeSource.nanoTime();
    }

    /**
     * Takes one token, waiting for it if needed.
     *
     * @throws RateLimitExceededException if no token is available within the wait budget,
     *         or the thread is interrupted while waiting
     */
    public void acquire() {
        long deadline = timeSource.nanoTime() + maxWait.toNanos();
        while (true) {
            long waitNanos;
            lock.lock();
            try {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                waitNanos = (long) Math.ceil((1.0 - tokens) / refillPerSecond * TimeUnit.SECONDS.toNanos(1));
            } finally {
                lock.unlock();
            }

            if (timeSource.nanoTime() + waitNanos > deadline) {
                LOG.debugf("Rate limit wait budget exhausted for %s", source.getValue());
                throw new RateLimitExceededException(source, maxWait);
            }
            try {
                timeSource.sleepNanos(waitNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RateLimitExceededException(source, maxWait, e);
            }
        }
    }

    /**
     * Takes a token only if one is available right now.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = timeSource.nanoTime();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillPerSecond / TimeUnit.SECONDS.toNanos(1));
            lastRefillNanos = now;
        }
    }

    /**
     * Clock and sleep used by the limiter.
     */
    public interface TimeSource {

        TimeSource SYSTEM = new TimeSource() {
            @Override
            public long nanoTime() {
                return System.nanoTime();
            }

            @Override
            public void sleepNanos(long nanos) throws InterruptedException {
                TimeUnit.NANOSECONDS.sleep(nanos);
            }
        };

        long nanoTime();

        void sleepNanos(long nanos) throws InterruptedException;
    }
}
