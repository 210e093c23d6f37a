package io.partybroker.storage;

import io.partybroker.config.BrokerConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

public final class Database {
    static final String BUSY_TIMEOUT_MS = "5000";

    private final BrokerConfig config;
    private final String jdbcUrl;

    public Database(BrokerConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String partyCode() {
        return config.partyCode();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        // busy_timeout is per connection; replicas sharing the file contend on the GC lease row.
        Properties props = new Properties();
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, props);
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
                    CREATE TABLE IF NOT EXISTS projects (
                        project_id TEXT PRIMARY KEY,
                        creator TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS project_members (
                        project_id TEXT NOT NULL,
                        party_code TEXT NOT NULL,
                        PRIMARY KEY(project_id, party_code)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS table_metas (
                        project_id TEXT NOT NULL,
                        table_name TEXT NOT NULL,
                        owner TEXT NOT NULL,
                        ref_table TEXT NOT NULL,
                        db_type TEXT NOT NULL DEFAULT '',
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(project_id, table_name)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS column_metas (
                        project_id TEXT NOT NULL,
                        table_name TEXT NOT NULL,
                        column_name TEXT NOT NULL,
                        data_type TEXT NOT NULL,
                        ordinal INTEGER NOT NULL,
                        PRIMARY KEY(project_id, table_name, column_name)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS column_privs (
                        project_id TEXT NOT NULL,
                        table_name TEXT NOT NULL,
                        column_name TEXT NOT NULL,
                        dest_party TEXT NOT NULL,
                        priv TEXT NOT NULL,
                        PRIMARY KEY(project_id, table_name, column_name, dest_party)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_infos (
                        session_id TEXT PRIMARY KEY,
                        project_id TEXT NOT NULL DEFAULT '',
                        issuer TEXT NOT NULL DEFAULT '',
                        query TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        output_names TEXT NOT NULL DEFAULT '[]',
                        warning TEXT NOT NULL DEFAULT '{}',
                        engine_endpoint TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS session_results (
                        session_id TEXT PRIMARY KEY,
                        result TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS gc_locks (
                        lock_name TEXT PRIMARY KEY,
                        owner TEXT NOT NULL DEFAULT '',
                        expired_at_ms INTEGER NOT NULL DEFAULT 0
                    )
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_column_metas_table ON column_metas(project_id, table_name, ordinal)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_column_privs_table ON column_privs(project_id, table_name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_session_infos_status ON session_infos(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_session_infos_created ON session_infos(created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_session_results_created ON session_results(created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
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
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
