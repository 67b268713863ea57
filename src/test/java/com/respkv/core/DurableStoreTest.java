package com.respkv.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DurableStoreTest extends StorageEngineContractTest {

    @TempDir
    Path tempDir;

    private Path dataFile;

    @Override
    protected StorageEngine createStore(MutableClock clock) {
        dataFile = tempDir.resolve("respkv.db");
        DurableStore durableStore = new DurableStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);
        durableStore.init(dataFile.toString());
        return durableStore;
    }

    @Test
    void init_createsTableAndIndex() throws SQLException {
        List<String> objects = new ArrayList<>();
        try (Connection conn = openRaw();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT name FROM sqlite_master WHERE tbl_name = 'data'")) {
            while (rs.next()) {
                objects.add(rs.getString(1));
            }
        }

        assertThat(objects).contains("data", "idx_data_key");
    }

    @Test
    void init_existingFile_isIdempotentAndKeepsData() {
        store.set("key1", "value");
        store.expire("key1", 100);

        DurableStore reopened = new DurableStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);
        try {
            reopened.init(dataFile.toString());
            reopened.init(dataFile.toString());

            assertThat(reopened.get("key1")).contains("value");
            assertThat(reopened.ttl("key1")).isEqualTo(100);
        } finally {
            reopened.close();
        }
    }

    @Test
    void init_createsMissingParentDirectories() {
        Path nested = tempDir.resolve("a").resolve("b").resolve("data.db");
        DurableStore nestedStore = new DurableStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);
        try {
            nestedStore.init(nested.toString());
            nestedStore.set("key1", "value");

            assertThat(Files.exists(nested)).isTrue();
            assertThat(nestedStore.getUrl()).isEqualTo(DurableStore.JDBC_PREFIX + nested);
        } finally {
            nestedStore.close();
        }
    }

    @Test
    void init_acceptsJdbcUrl() {
        String url = DurableStore.JDBC_PREFIX + tempDir.resolve("url.db");
        DurableStore urlStore = new DurableStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);
        try {
            urlStore.init(url);
            urlStore.set("key1", "value");

            assertThat(urlStore.get("key1")).contains("value");
            assertThat(urlStore.getUrl()).isEqualTo(url);
        } finally {
            urlStore.close();
        }
    }

    @Test
    void init_blankPath_throwsStorageException() {
        DurableStore blank = new DurableStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);
        try {
            assertThatThrownBy(() -> blank.init(" "))
                .isInstanceOf(StorageException.class);
        } finally {
            blank.close();
        }
    }

    @Test
    void operations_beforeInit_throwException() {
        DurableStore uninitialized = new DurableStore(clock, AbstractStorageEngine.DEFAULT_SWEEP_INTERVAL_MS);

        assertThatThrownBy(() -> uninitialized.get("key1"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(uninitialized.getUrl()).isNull();
    }

    @Test
    void operations_afterClose_throwException() {
        store.close();

        assertThatThrownBy(() -> store.set("key1", "value"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void set_keepsSingleRowPerKey() throws SQLException {
        store.set("key1", "value1");
        store.expire("key1", 50);
        store.set("key1", "value2");

        try (Connection conn = openRaw();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT COUNT(*), MAX(value), MAX(expiration) FROM data WHERE key = ?")) {
            stmt.setString(1, "key1");
            try (ResultSet rs = stmt.executeQuery()) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getInt(1)).isEqualTo(1);
                assertThat(rs.getString(2)).isEqualTo("value2");
                rs.getLong(3);
                assertThat(rs.wasNull()).isTrue();
            }
        }
    }

    @Test
    void expire_storesAbsoluteEpochSeconds() throws SQLException {
        store.set("key1", "value");
        store.expire("key1", 30);

        long expected = clock.instant().getEpochSecond() + 30;
        try (Connection conn = openRaw();
             PreparedStatement stmt = conn.prepareStatement("SELECT expiration FROM data WHERE key = ?")) {
            stmt.setString(1, "key1");
            try (ResultSet rs = stmt.executeQuery()) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getLong(1)).isEqualTo(expected);
            }
        }
    }

    @Test
    void sweepExpired_physicallyDeletesRows() throws SQLException {
        store.set("expiring", "1");
        store.set("permanent", "2");
        store.expire("expiring", 1);
        clock.advanceSeconds(2);

        assertThat(countRows()).isEqualTo(2);

        store.sweepExpired();

        assertThat(countRows()).isEqualTo(1);
    }

    @Test
    void backgroundSweep_deletesExpiredRows() throws Exception {
        Path sweptFile = tempDir.resolve("swept.db");
        DurableStore sweeping = new DurableStore(clock, 20);
        try {
            sweeping.init(sweptFile.toString());
            sweeping.set("expiring", "1");
            sweeping.set("permanent", "2");
            sweeping.expire("expiring", 1);
            clock.advanceSeconds(2);

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            int rows = countRows(sweptFile);
            while (rows > 1 && System.nanoTime() < deadline) {
                Thread.sleep(20);
                rows = countRows(sweptFile);
            }

            assertThat(rows).isEqualTo(1);
        } finally {
            sweeping.close();
        }
    }

    private Connection openRaw() throws SQLException {
        return DriverManager.getConnection(DurableStore.JDBC_PREFIX + dataFile);
    }

    private int countRows() throws SQLException {
        return countRows(dataFile);
    }

    private static int countRows(Path file) throws SQLException {
        try (Connection conn = DriverManager.getConnection(DurableStore.JDBC_PREFIX + file);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM data")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}
