package com.livequery.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Connection pool over a single DuckDB database.
 *
 * <p>One root connection opens the database; every pooled connection is a
 * {@link DuckDBConnection#duplicate()} of it, so all of them see the same
 * tables, including for in-memory databases. Subscriptions, mutations and
 * administrative statements borrow connections concurrently.
 *
 * <p>Example usage:
 * <pre>
 *   DuckDBConnectionManager manager = new DuckDBConnectionManager(
 *       DuckDBConnectionManager.Configuration.inMemory().withPoolSize(4));
 *
 *   try (PooledConnection pooled = manager.borrowConnection()) {
 *       // Execute queries with pooled.get()
 *   }
 *
 *   manager.close();
 * </pre>
 *
 * @see QueryExecutor
 */
public class DuckDBConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConnectionManager.class);

    /** Seconds to wait for a free connection */
    private static final long BORROW_TIMEOUT_SECONDS = 30;

    private final String jdbcUrl;
    private final DuckDBConnection rootConnection;
    private final BlockingQueue<DuckDBConnection> connectionPool;
    private final int poolSize;
    private volatile boolean closed = false;

    /**
     * Creates a connection manager with default in-memory configuration.
     */
    public DuckDBConnectionManager() {
        this(Configuration.inMemory());
    }

    /**
     * Creates a connection manager with the specified configuration.
     *
     * @param config the configuration
     * @throws IllegalStateException if the database cannot be opened
     */
    public DuckDBConnectionManager(Configuration config) {
        Objects.requireNonNull(config, "config must not be null");

        this.jdbcUrl = config.inMemory ? "jdbc:duckdb:" : "jdbc:duckdb:" + config.databasePath;
        this.poolSize = config.poolSize > 0 ? config.poolSize :
                        Math.min(Runtime.getRuntime().availableProcessors(), 8);
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);

        try {
            Connection conn = DriverManager.getConnection(jdbcUrl);
            this.rootConnection = conn.unwrap(DuckDBConnection.class);
            for (int i = 0; i < poolSize; i++) {
                connectionPool.offer(createConnection());
            }
        } catch (SQLException e) {
            closeQuietly();
            throw new IllegalStateException("Failed to initialize connection pool: " + jdbcUrl, e);
        }

        logger.info("DuckDB connection pool ready: url={}, poolSize={}", jdbcUrl, poolSize);
    }

    /**
     * Acquires a connection, waiting up to 30 seconds for one to be free.
     *
     * @return a connection from the pool
     * @throws SQLException if the pool is exhausted, interrupted or closed
     */
    public DuckDBConnection getConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Connection manager is closed");
        }

        try {
            DuckDBConnection conn = connectionPool.poll(BORROW_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (conn == null) {
                throw new SQLException("Connection pool exhausted - timeout after "
                    + BORROW_TIMEOUT_SECONDS + " seconds");
            }
            if (!conn.isClosed()) {
                return conn;
            }
            return createConnection();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    /**
     * Borrows a connection that is released when the wrapper is closed.
     *
     * @return pooled connection that auto-releases on close
     * @throws SQLException if no connection available or pool is closed
     */
    public PooledConnection borrowConnection() throws SQLException {
        return new PooledConnection(getConnection(), this);
    }

    /**
     * Returns a connection to the pool, replacing it if it is no longer usable.
     *
     * @param conn the connection to release (may be null)
     */
    public void releaseConnection(DuckDBConnection conn) {
        if (conn == null) {
            return;
        }
        if (closed) {
            closeConnection(conn);
            return;
        }

        try {
            if (conn.isClosed()) {
                logger.warn("Closed connection returned to pool, replacing it");
                conn = createConnection();
            } else if (!conn.getAutoCommit()) {
                conn.rollback();
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            logger.warn("Failed to reset connection: {}", e.getMessage());
            closeConnection(conn);
            return;
        }

        if (!connectionPool.offer(conn)) {
            logger.warn("Connection pool full, closing extra connection");
            closeConnection(conn);
        }
    }

    private DuckDBConnection createConnection() throws SQLException {
        DuckDBConnection conn = (DuckDBConnection) rootConnection.duplicate();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SET enable_progress_bar=false");
        }
        return conn;
    }

    private void closeConnection(DuckDBConnection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.warn("Failed to close connection: {}", e.getMessage());
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (SQLException e) {
            logger.warn("Error while cleaning up failed pool: {}", e.getMessage());
        }
    }

    /**
     * Closes all pooled connections and the database.
     *
     * @throws SQLException if any connection fails to close
     */
    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;

        SQLException firstException = null;
        DuckDBConnection conn;
        while ((conn = connectionPool.poll()) != null) {
            try {
                conn.close();
            } catch (SQLException e) {
                if (firstException == null) {
                    firstException = e;
                }
            }
        }

        if (rootConnection != null) {
            try {
                rootConnection.close();
            } catch (SQLException e) {
                if (firstException == null) {
                    firstException = e;
                }
            }
        }

        logger.info("DuckDB connection pool closed: {}", jdbcUrl);
        if (firstException != null) {
            throw firstException;
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Configuration for the connection manager.
     */
    public static class Configuration {
        /** Whether to use in-memory database */
        public boolean inMemory = true;

        /** Database file path (for persistent databases) */
        public String databasePath = null;

        /** Connection pool size (0 = auto-detect) */
        public int poolSize = 0;

        public static Configuration inMemory() {
            Configuration config = new Configuration();
            config.inMemory = true;
            return config;
        }

        public static Configuration persistent(String path) {
            Configuration config = new Configuration();
            config.inMemory = false;
            config.databasePath = Objects.requireNonNull(path, "path must not be null");
            return config;
        }

        /**
         * @param size the pool size (0 for auto-detect)
         * @return this configuration
         */
        public Configuration withPoolSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("poolSize must be non-negative");
            }
            this.poolSize = size;
            return this;
        }
    }
}
