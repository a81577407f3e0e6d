package br.edu.ifba.socialgraph.storage.impl;

import java.time.Duration;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import br.edu.ifba.socialgraph.cache.CacheConfig;
import br.edu.ifba.socialgraph.storage.CacheStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * In-process {@link CacheStore} on a bounded Caffeine cache. Each entry expires after
 * the TTL it was written with; reads do not extend it.
 */
@ApplicationScoped
public class CaffeineCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(CaffeineCacheStore.class);

    private static final long DEFAULT_MAXIMUM_SIZE = 10_000L;

    private final Cache<String, Entry> cache;

    protected CaffeineCacheStore() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }

    @Inject
    public CaffeineCacheStore(CacheConfig config) {
        this(config.maximumSize(), Ticker.systemTicker());
    }

    public CaffeineCacheStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry entry, long currentTime) {
                    return entry.ttlNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                    return entry.ttlNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .ticker(ticker)
            .build();
    }

    @Override
    public Optional<String> get(@NotNull String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void set(@NotNull String key, @NotNull String value, @NotNull Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        cache.put(key, new Entry(value, ttl.toNanos()));
        logger.debug("Cached entry {} for {}", key, ttl);
    }

    @Override
    public void delete(@NotNull String key) {
        cache.invalidate(key);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private record Entry(String value, long ttlNanos) {
    }
}
