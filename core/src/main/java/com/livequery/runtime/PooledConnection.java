package com.livequery.runtime;

import org.duckdb.DuckDBConnection;

import java.util.Objects;

/**
 * Auto-closeable loan of a pooled DuckDB connection.
 *
 * <pre>
 *   try (PooledConnection conn = manager.borrowConnection()) {
 *       PreparedStatement stmt = conn.get().prepareStatement(sql);
 *       ...
 *   } // Automatically released back to pool
 * </pre>
 *
 * @see DuckDBConnectionManager
 */
public class PooledConnection implements AutoCloseable {

    private final DuckDBConnection connection;
    private final DuckDBConnectionManager manager;
    private boolean released = false;

    PooledConnection(DuckDBConnection connection, DuckDBConnectionManager manager) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
    }

    /**
     * @return the underlying connection
     * @throws IllegalStateException if connection already released
     */
    public DuckDBConnection get() {
        if (released) {
            throw new IllegalStateException("Connection already released to pool");
        }
        return connection;
    }

    /**
     * Returns the connection to the pool. Idempotent.
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            manager.releaseConnection(connection);
        }
    }

    public boolean isReleased() {
        return released;
    }
}
