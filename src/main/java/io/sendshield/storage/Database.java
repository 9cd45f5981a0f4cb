package io.sendshield.storage;

import io.sendshield.config.SendShieldConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final SendShieldConfig config;
    private final String jdbcUrl;

    public Database(SendShieldConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS queued_messages(
                      id TEXT PRIMARY KEY,
                      account_id TEXT NOT NULL,
                      recipient TEXT NOT NULL,
                      kind TEXT NOT NULL,
                      payload_json TEXT NOT NULL,
                      options_json TEXT NOT NULL,
                      priority_rank INTEGER NOT NULL,
                      attempts INTEGER NOT NULL,
                      max_attempts INTEGER NOT NULL,
                      enqueued_at_ms INTEGER NOT NULL,
                      next_eligible_at_ms INTEGER NOT NULL,
                      last_error TEXT,
                      status TEXT NOT NULL,
                      updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_queued_dispatch ON queued_messages(account_id,status,priority_rank,enqueued_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queued_status_updated ON queued_messages(status,updated_at_ms)");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !expected.equalsIgnoreCase(actual.trim())) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
