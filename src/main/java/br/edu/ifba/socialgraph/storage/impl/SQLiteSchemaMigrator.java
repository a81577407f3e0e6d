package br.edu.ifba.socialgraph.storage.impl;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

/**
 * Applies versioned schema migrations from {@code /db/migrations/} on the classpath.
 *
 * <p>Files follow {@code V{version}__{description}.sql}. Applied versions are recorded
 * in {@code schema_version}; migrations at or below the recorded version are skipped.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this(List.of(
            new Migration(1, "graph nodes and edges", MIGRATION_PATH + "V001__graph_schema.sql"),
            new Migration(2, "browse indexes", MIGRATION_PATH + "V002__browse_indexes.sql")
        ));
    }

    SQLiteSchemaMigrator(List<Migration> migrations) {
        this.migrations = List.copyOf(migrations);
    }

    /**
     * @return the highest applied version, 0 for an empty database
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(
                 "SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'schema_version'")) {
            if (!rs.next()) {
                return 0;
            }
        }
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    /**
     * Applies pending migrations in one transaction.
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);
            ensureVersionTable(conn);
            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    apply(conn, migration);
                }
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public List<Migration> getMigrations() {
        return migrations;
    }

    private void ensureVersionTable(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    description TEXT NOT NULL,
                    applied_at TEXT NOT NULL DEFAULT (datetime('now'))
                )
                """);
        }
    }

    private void apply(Connection conn, Migration migration) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String statement : splitStatements(load(migration.resourcePath()))) {
                stmt.execute(statement);
            }
        }
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
            stmt.setInt(1, migration.version());
            stmt.setString(2, migration.description());
            stmt.executeUpdate();
        }
    }

    private String load(String resourcePath) {
        try (InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
        }
    }

    /**
     * Splits a script on semicolons outside quotes, dropping {@code --} comments.
     */
    static List<String> splitStatements(String sql) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                current.append(c);
            } else if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? sql.length() : end;
                continue;
            } else if (c == ';') {
                addIfNotBlank(statements, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
            i++;
        }
        addIfNotBlank(statements, current);
        return statements;
    }

    private static void addIfNotBlank(List<String> statements, StringBuilder sql) {
        String statement = sql.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }

    public record Migration(int version, String description, String resourcePath) {
    }
}
