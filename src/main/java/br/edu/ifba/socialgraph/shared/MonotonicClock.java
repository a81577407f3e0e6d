package br.edu.ifba.socialgraph.shared;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall clock with microsecond resolution whose readings never repeat or go backwards.
 *
 * <p>Stores rely on it so that creation times give a total order for tie-breaking.</p>
 */
public final class MonotonicClock {

    private final Clock clock;
    private final AtomicLong lastMicros = new AtomicLong();

    public MonotonicClock() {
        this(Clock.systemUTC());
    }

    public MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        Instant wall = clock.instant();
        long wallMicros = wall.getEpochSecond() * 1_000_000L + wall.getNano() / 1_000L;
        long micros = lastMicros.updateAndGet(last -> Math.max(last + 1, wallMicros));
        return Instant.ofEpochSecond(micros / 1_000_000L, (micros % 1_000_000L) * 1_000L);
    }
}
