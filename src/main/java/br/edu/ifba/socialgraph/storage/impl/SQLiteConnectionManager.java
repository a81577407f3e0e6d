package br.edu.ifba.socialgraph.storage.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;

/**
 * Hands out SQLite connections to the graph store.
 *
 * <p>Reads share a small pool of connections. All writes go through a single connection
 * guarded by a {@link ReentrantLock}, which is what serializes read-merge-write upserts.
 * WAL mode lets readers proceed while the writer holds the lock.</p>
 *
 * <pre>
 * Connection conn = manager.getWriteConnection();
 * try {
 *     // write
 * } finally {
 *     manager.releaseWriteConnection(conn);
 * }
 * </pre>
 */
public final class SQLiteConnectionManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SQLiteConnectionManager.class);

    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_POOL_SIZE = 4;

    private final String databasePath;
    private final Duration busyTimeout;
    private final boolean walMode;
    private final BlockingQueue<Connection> readPool;
    private final ReentrantLock writeLock = new ReentrantLock();

    private Connection writeConnection;
    private volatile boolean closed = false;

    public SQLiteConnectionManager(String databasePath) {
        this(databasePath, DEFAULT_BUSY_TIMEOUT, true, DEFAULT_POOL_SIZE);
    }

    /**
     * @param databasePath path to the database file
     * @param busyTimeout how long SQLite waits on a locked database
     * @param walMode whether to switch the journal to WAL
     * @param readPoolSize connections kept for reads
     */
    public SQLiteConnectionManager(String databasePath, Duration busyTimeout, boolean walMode, int readPoolSize) {
        if (readPoolSize < 1) {
            throw new IllegalArgumentException("readPoolSize must be at least 1");
        }
        this.databasePath = databasePath;
        this.busyTimeout = busyTimeout;
        this.walMode = walMode;
        this.readPool = new ArrayBlockingQueue<>(readPoolSize);
    }

    /**
     * Opens a new connection with foreign keys enforced and pragmas applied.
     */
    public Connection createConnection() {
        ensureOpen();
        createParentDirectory();
        try {
            SQLiteConfig config = new SQLiteConfig();
            config.enforceForeignKeys(true);
            config.setBusyTimeout((int) busyTimeout.toMillis());

            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + databasePath, config.toProperties());
            applyPragmas(conn);
            LOG.debugf("Created SQLite connection to %s", databasePath);
            return conn;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create SQLite connection to " + databasePath, e);
        }
    }

    public Connection getReadConnection() {
        ensureOpen();
        Connection conn = readPool.poll();
        if (conn != null) {
            try {
                if (!conn.isClosed()) {
                    return conn;
                }
            } catch (SQLException e) {
                LOG.debug("Pooled read connection is unusable, opening a new one", e);
            }
        }
        return createConnection();
    }

    public void releaseReadConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            if (closed || conn.isClosed() || !readPool.offer(conn)) {
                conn.close();
            }
        } catch (SQLException e) {
            LOG.debug("Error releasing read connection", e);
        }
    }

    /**
     * Acquires the exclusive write connection. Must be paired with
     * {@link #releaseWriteConnection(Connection)}; closing the connection does not release the lock.
     */
    public Connection getWriteConnection() {
        ensureOpen();
        writeLock.lock();
        try {
            if (writeConnection == null || writeConnection.isClosed()) {
                writeConnection = createConnection();
            }
            return writeConnection;
        } catch (SQLException | RuntimeException e) {
            writeLock.unlock();
            throw new IllegalStateException("Failed to get write connection", e);
        }
    }

    public void releaseWriteConnection(Connection conn) {
        if (conn == writeConnection && writeLock.isHeldByCurrentThread()) {
            writeLock.unlock();
        }
    }

    void applyPragmas(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (walMode) {
                stmt.execute("PRAGMA journal_mode = WAL");
            }
            stmt.execute("PRAGMA synchronous = NORMAL");
            stmt.execute("PRAGMA temp_store = MEMORY");
        }
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isWalModeEnabled() {
        return walMode;
    }

    @Override
    public void close() {
        closed = true;
        writeLock.lock();
        try {
            if (writeConnection != null) {
                try {
                    writeConnection.close();
                } catch (SQLException e) {
                    LOG.debug("Error closing write connection", e);
                }
                writeConnection = null;
            }
        } finally {
            writeLock.unlock();
        }

        Connection conn;
        while ((conn = readPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                LOG.debug("Error closing pooled connection", e);
            }
        }
        LOG.infof("Closed SQLite connection manager for %s", databasePath);
    }

    private void createParentDirectory() {
        if (databasePath.startsWith(":memory:")) {
            return;
        }
        Path parent = Paths.get(databasePath).toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            try {
                Files.createDirectories(parent);
                LOG.infof("Created database directory: %s", parent);
            } catch (IOException e) {
                LOG.warnf("Could not create parent directory for %s: %s", databasePath, e.getMessage());
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }
}
