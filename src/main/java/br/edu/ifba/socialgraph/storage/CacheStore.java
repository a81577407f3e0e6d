package br.edu.ifba.socialgraph.storage;

import java.time.Duration;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * Key-value cache with per-entry time to live.
 *
 * <p>Values are opaque strings (JSON documents in practice). Expired entries behave as
 * absent.</p>
 */
public interface CacheStore {

    Optional<String> get(@NotNull String key);

    void set(@NotNull String key, @NotNull String value, @NotNull Duration ttl);

    void delete(@NotNull String key);

    /**
     * Number of live entries, for diagnostics.
     */
    long size();
}
