package br.edu.ifba.socialgraph.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.socialgraph.storage.GraphStore;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * Produces the SQLite {@link GraphStore} when {@code socialgraph.storage.backend=sqlite}.
 *
 * <pre>
 * socialgraph.storage.backend=sqlite
 * socialgraph.storage.sqlite.path=data/social-graph.db
 * </pre>
 *
 * Schema migrations run once on startup.
 */
@ApplicationScoped
@IfBuildProperty(name = "socialgraph.storage.backend", stringValue = "sqlite")
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "socialgraph.storage.sqlite.path", defaultValue = "data/social-graph.db")
    String databasePath;

    @ConfigProperty(name = "socialgraph.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "socialgraph.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "socialgraph.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphStore graphStore;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);
        connectionManager = new SQLiteConnectionManager(
            databasePath, Duration.ofMillis(busyTimeoutMs), walMode, readPoolSize);

        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to run SQLite schema migrations", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        if (graphStore != null) {
            graphStore.close();
        }
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "socialgraph.storage.backend", stringValue = "sqlite")
    public GraphStore produceGraphStore() {
        if (graphStore == null) {
            graphStore = new SQLiteGraphStore(connectionManager);
            graphStore.initialize().join();
        }
        return graphStore;
    }
}
