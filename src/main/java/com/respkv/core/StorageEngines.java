package com.respkv.core;

import java.time.Clock;

/**
 * Backend selection from a storage connection string.
 */
public final class StorageEngines {

    /** Connection string that selects the in-process backend. */
    public static final String VOLATILE = "volatile";

    private StorageEngines() {
        // Utility class
    }

    /**
     * Create and initialize the backend named by a connection string:
     * {@value #VOLATILE} for the in-process store, anything else is the
     * path of a SQLite data file.
     *
     * @param storage         connection string
     * @param sweepIntervalMs interval between expiration sweeps
     * @return an initialized engine, with its sweep running
     * @throws StorageException if the backend cannot be initialized
     */
    public static StorageEngine open(String storage, long sweepIntervalMs) {
        StorageEngine engine = isVolatile(storage)
                ? new VolatileStore(Clock.systemUTC(), sweepIntervalMs)
                : new DurableStore(Clock.systemUTC(), sweepIntervalMs);
        try {
            engine.init(storage);
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }
        return engine;
    }

    public static boolean isVolatile(String storage) {
        return storage == null || storage.isBlank() || VOLATILE.equalsIgnoreCase(storage.trim());
    }
}
