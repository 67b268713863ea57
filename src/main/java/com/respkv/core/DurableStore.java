package com.respkv.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage engine backed by a single SQLite table.
 *
 * Every public operation is one SQL statement, except SET which deletes and
 * re-inserts the row inside one transaction so a stale expiration can never
 * survive an overwrite. Liveness is part of each query's WHERE clause, so
 * there is no separate lazy-expiry step. Isolation is whatever SQLite gives
 * a single statement; nothing is layered on top.
 */
public class DurableStore extends AbstractStorageEngine {

    private static final Logger logger = LoggerFactory.getLogger(DurableStore.class);

    static final String JDBC_PREFIX = "jdbc:sqlite:";
    private static final int BUSY_TIMEOUT_MS = 5000;
    private static final int DELETE_CHUNK_SIZE = 500;

    private static final String LIVE = "(expiration IS NULL OR expiration >= ?)";

    static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS data ("
            + "id INTEGER PRIMARY KEY, "
            + "key TEXT UNIQUE NOT NULL, "
            + "value TEXT, "
            + "expiration INTEGER NULL)";
    static final String CREATE_INDEX = "CREATE UNIQUE INDEX IF NOT EXISTS idx_data_key ON data (key)";

    private static final String DELETE_KEY = "DELETE FROM data WHERE key = ?";
    private static final String INSERT = "INSERT INTO data (key, value, expiration) VALUES (?, ?, NULL)";
    private static final String SELECT_VALUE = "SELECT value FROM data WHERE key = ? AND " + LIVE;
    private static final String SELECT_KEYS = "SELECT key FROM data WHERE " + LIVE;
    private static final String SELECT_EXPIRATION = "SELECT expiration FROM data WHERE key = ? AND " + LIVE;
    private static final String COUNT_LIVE = "SELECT COUNT(*) FROM data WHERE " + LIVE;
    private static final String UPDATE_EXPIRATION = "UPDATE data SET expiration = ? WHERE key = ? AND " + LIVE;
    private static final String DELETE_LIVE_KEY = "DELETE FROM data WHERE key = ? AND " + LIVE;
    private static final String SWEEP = "DELETE FROM data WHERE expiration < ?";

    private volatile SQLiteDataSource dataSource;
    private volatile String url;

    /**
     * Create a durable store with the system clock and default sweep interval.
     */
    public DurableStore() {
        this(Clock.systemUTC(), DEFAULT_SWEEP_INTERVAL_MS);
    }

    /**
     * Create a durable store.
     *
     * @param clock           expiration clock
     * @param sweepIntervalMs interval between sweeps in milliseconds
     */
    public DurableStore(Clock clock, long sweepIntervalMs) {
        super(clock, sweepIntervalMs);
    }

    /**
     * Open (creating if needed) the data file and its schema.
     *
     * @param connectionInfo a file path, or a {@code jdbc:sqlite:} URL
     */
    @Override
    protected void doInit(String connectionInfo) {
        if (connectionInfo == null || connectionInfo.isBlank()) {
            throw new StorageException("Durable store requires a data file path");
        }
        String jdbcUrl = toJdbcUrl(connectionInfo);

        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        SQLiteDataSource source = new SQLiteDataSource(config);
        source.setUrl(jdbcUrl);

        try (Connection conn = source.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(CREATE_TABLE);
            stmt.executeUpdate(CREATE_INDEX);
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize durable store at " + jdbcUrl, e);
        }

        this.dataSource = source;
        this.url = jdbcUrl;
        logger.info("Durable store ready at {}", jdbcUrl);
    }

    private static String toJdbcUrl(String connectionInfo) {
        if (connectionInfo.startsWith(JDBC_PREFIX)) {
            return connectionInfo;
        }
        Path path = Path.of(connectionInfo);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new StorageException("Failed to create data directory: " + parent, e);
            }
        }
        return JDBC_PREFIX + path;
    }

    @Override
    public void set(String key, String value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        try (Connection conn = connection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement delete = conn.prepareStatement(DELETE_KEY);
                 PreparedStatement insert = conn.prepareStatement(INSERT)) {
                delete.setString(1, key);
                delete.executeUpdate();
                insert.setString(1, key);
                insert.setString(2, value);
                insert.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("SET failed for key " + key, e);
        }
        logger.trace("SET key={}", key);
    }

    @Override
    public Optional<String> get(String key) {
        validateKey(key);
        try (Connection conn = connection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_VALUE)) {
            stmt.setString(1, key);
            stmt.setLong(2, now());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageException("GET failed for key " + key, e);
        }
    }

    @Override
    public int del(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        List<String> all = new ArrayList<>(keys);
        all.forEach(AbstractStorageEngine::validateKey);
        long now = now();
        int removed = 0;
        try (Connection conn = connection()) {
            for (int from = 0; from < all.size(); from += DELETE_CHUNK_SIZE) {
                List<String> chunk = all.subList(from, Math.min(all.size(), from + DELETE_CHUNK_SIZE));
                removed += deleteChunk(conn, chunk, now);
            }
        } catch (SQLException e) {
            throw new StorageException("DEL failed", e);
        }
        logger.trace("DEL keys={} -> {}", all.size(), removed);
        return removed;
    }

    private int deleteChunk(Connection conn, List<String> chunk, long now) throws SQLException {
        StringBuilder sql = new StringBuilder("DELETE FROM data WHERE key IN (");
        for (int i = 0; i < chunk.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
        }
        sql.append(") AND ").append(LIVE);
        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            int index = 1;
            for (String key : chunk) {
                stmt.setString(index++, key);
            }
            stmt.setLong(index, now);
            return stmt.executeUpdate();
        }
    }

    @Override
    public List<String> keys(String pattern) {
        KeyPattern matcher = KeyPattern.compile(pattern);
        List<String> matched = new ArrayList<>();
        try (Connection conn = connection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_KEYS)) {
            stmt.setLong(1, now());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String key = rs.getString(1);
                    if (matcher.matches(key)) {
                        matched.add(key);
                    }
                }
            }
        } catch (SQLException e) {
            throw new StorageException("KEYS failed for pattern " + pattern, e);
        }
        return matched;
    }

    @Override
    public boolean expire(String key, long seconds) {
        validateKey(key);
        long now = now();
        long deadline = seconds > 0 ? expiresAt(now, seconds) : now;
        try (Connection conn = connection()) {
            if (seconds <= 0) {
                try (PreparedStatement stmt = conn.prepareStatement(DELETE_LIVE_KEY)) {
                    stmt.setString(1, key);
                    stmt.setLong(2, now);
                    return stmt.executeUpdate() > 0;
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_EXPIRATION)) {
                stmt.setLong(1, deadline);
                stmt.setString(2, key);
                stmt.setLong(3, now);
                return stmt.executeUpdate() > 0;
            }
        } catch (SQLException e) {
            throw new StorageException("EXPIRE failed for key " + key, e);
        }
    }

    @Override
    public long ttl(String key) {
        validateKey(key);
        long now = now();
        try (Connection conn = connection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_EXPIRATION)) {
            stmt.setString(1, key);
            stmt.setLong(2, now);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return TTL_MISSING;
                }
                long expiresAt = rs.getLong(1);
                if (rs.wasNull()) {
                    return TTL_NO_EXPIRY;
                }
                return expiresAt - now;
            }
        } catch (SQLException e) {
            throw new StorageException("TTL failed for key " + key, e);
        }
    }

    @Override
    public int size() {
        try (Connection conn = connection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_LIVE)) {
            stmt.setLong(1, now());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("DBSIZE failed", e);
        }
    }

    @Override
    public int sweepExpired() {
        try (Connection conn = connection();
             PreparedStatement stmt = conn.prepareStatement(SWEEP)) {
            stmt.setLong(1, now());
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Expiration sweep failed", e);
        }
    }

    private Connection connection() throws SQLException {
        SQLiteDataSource source = dataSource;
        if (source == null) {
            throw new IllegalStateException("Durable store not initialized");
        }
        return source.getConnection();
    }

    @Override
    protected void doClose() {
        dataSource = null;
    }

    /**
     * JDBC URL of the data file, or null before {@link #init}.
     */
    public String getUrl() {
        return url;
    }
}
