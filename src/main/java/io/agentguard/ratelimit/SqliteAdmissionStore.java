package io.agentguard.ratelimit;

import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Admission counters in a SQLite file shared by every process that points at
 * the same path. Each check runs in an IMMEDIATE transaction, which holds the
 * database write lock from the read through the increment.
 */
public final class SqliteAdmissionStore implements DistributedAdmissionStore {
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final Path dbFile;
    private final String jdbcUrl;

    public SqliteAdmissionStore(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
    }

    public void init() {
        try {
            if (dbFile.getParent() != null) {
                Files.createDirectories(dbFile.getParent());
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to create admission store directory: " + dbFile, e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS admission_counters (
                        limiter_key TEXT PRIMARY KEY,
                        used INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_admission_expires ON admission_counters(expires_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize admission store: " + dbFile, e);
        }
    }

    Connection openConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(jdbcUrl, config.toProperties());
    }

    @Override
    public Admission tryAcquire(String key, int cost, int maxRequests, long windowMs, long nowMs) throws SQLException {
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try {
                Admission admission = acquireInTransaction(conn, key, cost, maxRequests, windowMs, nowMs);
                conn.commit();
                return admission;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private Admission acquireInTransaction(Connection conn, String key, int cost, int maxRequests, long windowMs, long nowMs)
            throws SQLException {
        Long used = null;
        long expiresAt = 0L;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT used, expires_at_ms FROM admission_counters WHERE limiter_key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    used = rs.getLong("used");
                    expiresAt = rs.getLong("expires_at_ms");
                }
            }
        }
        if (used == null || expiresAt <= nowMs) {
            if (cost > maxRequests) {
                return new Admission(false, windowMs);
            }
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO admission_counters(limiter_key, used, expires_at_ms) VALUES (?, ?, ?)
                    ON CONFLICT(limiter_key) DO UPDATE SET used = excluded.used, expires_at_ms = excluded.expires_at_ms
                    """)) {
                ps.setString(1, key);
                ps.setLong(2, cost);
                ps.setLong(3, nowMs + windowMs);
                ps.executeUpdate();
            }
            return new Admission(true, 0L);
        }
        if (used + cost <= maxRequests) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE admission_counters SET used = used + ? WHERE limiter_key = ?")) {
                ps.setLong(1, cost);
                ps.setString(2, key);
                ps.executeUpdate();
            }
            return new Admission(true, 0L);
        }
        return new Admission(false, expiresAt - nowMs);
    }

    @Override
    public void reset(String key) throws SQLException {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM admission_counters WHERE limiter_key = ?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }

    public int purgeExpired(long nowMs) {
        try (Connection conn = openConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM admission_counters WHERE expires_at_ms <= ?")) {
            ps.setLong(1, nowMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge expired admission counters", e);
        }
    }
}
