package com.respkv.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class VolatileStoreTest extends StorageEngineContractTest {

    @Override
    protected StorageEngine createStore(MutableClock clock) {
        VolatileStore volatileStore = new VolatileStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);
        volatileStore.init(StorageEngines.VOLATILE);
        return volatileStore;
    }

    @Test
    void constructor_nonPositiveSweepInterval_throwsException() {
        assertThatThrownBy(() -> new VolatileStore(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sweepIntervalMs");
    }

    @Test
    void constructor_nullClock_throwsException() {
        assertThatThrownBy(() -> new VolatileStore(null, 1000))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void init_ignoresConnectionInfo() {
        VolatileStore other = new VolatileStore(clock, 1000);
        try {
            other.init(null);
            other.init("");
            other.set("key1", "value");

            assertThat(other.get("key1")).contains("value");
        } finally {
            other.close();
        }
    }

    @Test
    void close_marksStoreClosed() {
        VolatileStore other = new VolatileStore(clock, 1000);
        other.init(StorageEngines.VOLATILE);

        other.close();

        assertThat(other.isClosed()).isTrue();
    }

    @Test
    void backgroundSweep_removesExpiredKeys() throws InterruptedException {
        CountDownLatch swept = new CountDownLatch(1);
        VolatileStore sweeping = new VolatileStore(clock, 20) {
            @Override
            public int sweepExpired() {
                int removed = super.sweepExpired();
                if (removed > 0) {
                    swept.countDown();
                }
                return removed;
            }
        };
        sweeping.init(StorageEngines.VOLATILE);
        try {
            sweeping.set("expiring", "1");
            sweeping.set("permanent", "2");
            sweeping.expire("expiring", 1);
            clock.advanceSeconds(2);

            assertThat(swept.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(sweeping.keys("*")).containsExactly("permanent");
        } finally {
            sweeping.close();
        }
    }

    @Test
    void backgroundSweep_survivesFailedRun() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        VolatileStore flaky = new VolatileStore(Clock.systemUTC(), 20) {
            @Override
            public int sweepExpired() {
                if (runs.incrementAndGet() == 1) {
                    throw new StorageException("simulated sweep failure");
                }
                recovered.countDown();
                return super.sweepExpired();
            }
        };
        flaky.init(StorageEngines.VOLATILE);
        try {
            assertThat(recovered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(runs.get()).isGreaterThanOrEqualTo(2);
        } finally {
            flaky.close();
        }
    }

    @Test
    void lazyExpiry_getRemovesEntryBeforeSweep() {
        store.set("key1", "value");
        store.expire("key1", 1);
        clock.advanceSeconds(2);

        assertThat(store.get("key1")).isEmpty();

        // Already reclaimed by the read, nothing left to sweep
        assertThat(store.sweepExpired()).isZero();
    }
}
