package io.voterelay.storage;

import io.voterelay.config.VoteRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final VoteRelayConfig config;
    private final String jdbcUrl;

    public Database(VoteRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String namespace() {
        return config.namespace();
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
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS active_delegations (
                        namespace TEXT NOT NULL DEFAULT 'default',
                        delegator TEXT NOT NULL,
                        delegation_id INTEGER NOT NULL,
                        delegate TEXT NOT NULL,
                        expiry INTEGER,
                        created_at INTEGER NOT NULL,
                        PRIMARY KEY(namespace, delegator),
                        CHECK (delegator <> delegate)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS delegation_history (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        delegator TEXT NOT NULL,
                        delegation_id INTEGER NOT NULL,
                        delegate TEXT NOT NULL,
                        created_at INTEGER NOT NULL,
                        ended_at INTEGER,
                        ended_reason TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS delegation_ids (
                        namespace TEXT PRIMARY KEY,
                        last_id INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS upstream_counts (
                        namespace TEXT NOT NULL DEFAULT 'default',
                        signer TEXT NOT NULL,
                        distance INTEGER NOT NULL,
                        count INTEGER NOT NULL,
                        PRIMARY KEY(namespace, signer, distance),
                        CHECK (distance >= 1 AND count > 0)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_history_delegator_seq ON delegation_history(namespace, delegator, seq)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_active_delegation_id ON active_delegations(delegation_id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA foreign_keys=ON");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "busy_timeout", "5000");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
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
