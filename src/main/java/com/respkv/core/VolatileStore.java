package com.respkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process storage engine.
 *
 * Values and expirations live in two maps guarded together by a single
 * read/write lock, so a value and its expiration always change as a pair.
 * Reads take the read lock; every mutation, including lazy removal of an
 * expired entry found by a read, takes the write lock.
 */
public class VolatileStore extends AbstractStorageEngine {

    private static final Logger logger = LoggerFactory.getLogger(VolatileStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, Long> expirations = new HashMap<>();

    /**
     * Create a volatile store with the system clock and default sweep interval.
     */
    public VolatileStore() {
        this(Clock.systemUTC(), DEFAULT_SWEEP_INTERVAL_MS);
    }

    /**
     * Create a volatile store with a custom sweep interval.
     *
     * @param sweepIntervalMs interval between sweeps in milliseconds
     */
    public VolatileStore(long sweepIntervalMs) {
        this(Clock.systemUTC(), sweepIntervalMs);
    }

    /**
     * Create a volatile store.
     *
     * @param clock           expiration clock
     * @param sweepIntervalMs interval between sweeps in milliseconds
     */
    public VolatileStore(Clock clock, long sweepIntervalMs) {
        super(clock, sweepIntervalMs);
    }

    @Override
    protected void doInit(String connectionInfo) {
        logger.info("Volatile store ready");
    }

    @Override
    public void set(String key, String value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        lock.writeLock().lock();
        try {
            values.put(key, value);
            expirations.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
        logger.trace("SET key={}", key);
    }

    @Override
    public Optional<String> get(String key) {
        validateKey(key);
        long now = now();
        lock.readLock().lock();
        try {
            String value = values.get(key);
            if (value == null) {
                return Optional.empty();
            }
            if (isLive(expirations.get(key), now)) {
                return Optional.of(value);
            }
        } finally {
            lock.readLock().unlock();
        }
        removeIfExpired(key, now);
        return Optional.empty();
    }

    @Override
    public int del(Collection<String> keys) {
        long now = now();
        int removed = 0;
        lock.writeLock().lock();
        try {
            for (String key : keys) {
                validateKey(key);
                if (values.remove(key) != null) {
                    Long expiresAt = expirations.remove(key);
                    if (isLive(expiresAt, now)) {
                        removed++;
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.trace("DEL keys={} -> {}", keys.size(), removed);
        return removed;
    }

    @Override
    public List<String> keys(String pattern) {
        KeyPattern matcher = KeyPattern.compile(pattern);
        long now = now();
        List<String> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (String key : values.keySet()) {
                if (isLive(expirations.get(key), now) && matcher.matches(key)) {
                    matched.add(key);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return matched;
    }

    @Override
    public boolean expire(String key, long seconds) {
        validateKey(key);
        long now = now();
        long deadline = seconds > 0 ? expiresAt(now, seconds) : now;
        lock.writeLock().lock();
        try {
            if (!values.containsKey(key)) {
                return false;
            }
            if (!isLive(expirations.get(key), now)) {
                values.remove(key);
                expirations.remove(key);
                return false;
            }
            if (seconds <= 0) {
                values.remove(key);
                expirations.remove(key);
            } else {
                expirations.put(key, deadline);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public long ttl(String key) {
        validateKey(key);
        long now = now();
        lock.readLock().lock();
        try {
            if (!values.containsKey(key)) {
                return TTL_MISSING;
            }
            Long expiresAt = expirations.get(key);
            if (expiresAt == null) {
                return TTL_NO_EXPIRY;
            }
            if (isLive(expiresAt, now)) {
                return expiresAt - now;
            }
        } finally {
            lock.readLock().unlock();
        }
        removeIfExpired(key, now);
        return TTL_MISSING;
    }

    @Override
    public int size() {
        long now = now();
        lock.readLock().lock();
        try {
            int live = values.size();
            for (Long expiresAt : expirations.values()) {
                if (!isLive(expiresAt, now)) {
                    live--;
                }
            }
            return live;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int sweepExpired() {
        long now = now();
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, Long>> it = expirations.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Long> entry = it.next();
                if (!isLive(entry.getValue(), now)) {
                    values.remove(entry.getKey());
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    /**
     * Lazy reclamation. The entry is re-checked under the write lock because a
     * concurrent SET or EXPIRE may have revived it after the read lock was released.
     */
    private void removeIfExpired(String key, long now) {
        lock.writeLock().lock();
        try {
            Long expiresAt = expirations.get(key);
            if (expiresAt != null && !isLive(expiresAt, now)) {
                values.remove(key);
                expirations.remove(key);
                logger.trace("Lazily removed expired key={}", key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
}
