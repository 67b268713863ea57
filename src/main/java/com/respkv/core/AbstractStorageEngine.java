package com.respkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle shared by the storage backends: the expiration clock and the
 * background sweep task that starts on {@link #init} and stops on {@link #close}.
 */
public abstract class AbstractStorageEngine implements StorageEngine {

    private static final Logger logger = LoggerFactory.getLogger(AbstractStorageEngine.class);

    /** Default interval between eager sweeps. */
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 60_000;

    private final Clock clock;
    private final long sweepIntervalMs;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledExecutorService sweepExecutor;

    protected AbstractStorageEngine(Clock clock, long sweepIntervalMs) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException("sweepIntervalMs must be positive");
        }
        this.clock = clock;
        this.sweepIntervalMs = sweepIntervalMs;
    }

    @Override
    public final void init(String connectionInfo) {
        if (closed.get()) {
            throw new IllegalStateException("Storage engine already closed");
        }
        doInit(connectionInfo);
        if (started.compareAndSet(false, true)) {
            startSweepTask();
        }
    }

    /**
     * Backend-specific initialization. May be called more than once.
     */
    protected abstract void doInit(String connectionInfo);

    /**
     * Backend-specific resource release, called once after the sweep stops.
     */
    protected void doClose() {
    }

    private void startSweepTask() {
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "respkv-sweeper");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(this::runSweep,
                sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
        logger.debug("Started expiration sweep for {} with interval {}ms",
                getClass().getSimpleName(), sweepIntervalMs);
    }

    private void runSweep() {
        // An exception escaping here would cancel every later run
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                logger.debug("Swept {} expired entries", removed);
            }
        } catch (RuntimeException e) {
            logger.error("Expiration sweep failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public final void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sweepExecutor != null) {
            sweepExecutor.shutdown();
            try {
                if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    sweepExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                sweepExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        doClose();
        logger.info("{} shutdown complete", getClass().getSimpleName());
    }

    /**
     * Current time on the expiration clock, in epoch seconds.
     */
    protected long now() {
        return clock.instant().getEpochSecond();
    }

    /**
     * Absolute expiration for a positive TTL.
     *
     * @throws IllegalArgumentException if now + seconds does not fit in a long
     */
    protected static long expiresAt(long now, long seconds) {
        try {
            return Math.addExact(now, seconds);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("invalid expire time: " + seconds, e);
        }
    }

    protected static boolean isLive(Long expiresAt, long now) {
        return expiresAt == null || now <= expiresAt;
    }

    protected static void validateKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public boolean isClosed() {
        return closed.get();
    }
}
