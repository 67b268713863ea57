package com.respkv.core;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage engine contract shared by every backend.
 * All implementations must be safe for concurrent use without external
 * synchronization, and must expose identical observable behavior.
 *
 * Expiration times are absolute epoch seconds. An entry is live while
 * {@code now <= expiresAt}; after that it is logically absent everywhere.
 */
public interface StorageEngine extends AutoCloseable {

    /** TTL reply for a live key that carries no expiration. */
    long TTL_NO_EXPIRY = -1;

    /** TTL reply for a key that does not exist or has expired. */
    long TTL_MISSING = -2;

    /**
     * Prepare backend state and start the background expiration sweep.
     * Safe to call against an already-initialized durable store.
     *
     * @param connectionInfo backend-specific connection string
     * @throws StorageException if the backend cannot be initialized
     */
    void init(String connectionInfo);

    /**
     * Store a value, replacing any previous value and clearing any expiration.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    void set(String key, String value);

    /**
     * Retrieve the value of a live key.
     *
     * @param key the key to look up
     * @return the value if the key exists and is not expired, empty otherwise
     */
    Optional<String> get(String key);

    /**
     * Delete every listed key. Missing keys are ignored.
     *
     * @param keys the keys to delete
     * @return the number of live keys that were removed
     */
    int del(Collection<String> keys);

    /**
     * List the live keys matching a glob pattern.
     *
     * @param pattern glob pattern, see {@link KeyPattern}
     * @return matching keys in no particular order
     */
    List<String> keys(String pattern);

    /**
     * Set a key's expiration to now + seconds.
     * A non-positive value removes the key immediately.
     *
     * @param key     the key
     * @param seconds seconds from now
     * @return true if the key existed and was updated, false otherwise
     * @throws IllegalArgumentException if now + seconds overflows; the key is left untouched
     */
    boolean expire(String key, long seconds);

    /**
     * Remaining time to live.
     *
     * @param key the key
     * @return seconds left, {@link #TTL_NO_EXPIRY} or {@link #TTL_MISSING}
     */
    long ttl(String key);

    /**
     * Number of live keys.
     */
    int size();

    /**
     * Physically remove every expired entry.
     *
     * @return the number of entries removed
     */
    int sweepExpired();

    /**
     * Stop the sweep task and release backend resources.
     */
    @Override
    void close();
}
