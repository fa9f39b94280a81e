package com.livequery.runtime;

import com.livequery.exception.QueryExecutionException;
import com.livequery.execution.ResultBatch;
import com.livequery.execution.SessionContext;
import com.livequery.execution.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Executes SQL against DuckDB and materializes the results.
 *
 * <p>Every statement is prepared and its parameters are bound positionally,
 * so values never become part of the statement text. Each call borrows its
 * own pooled connection, which makes the executor safe to share between
 * subscriptions and mutation requests.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(connectionManager);
 *
 *   ResultBatch rows = executor.executeQuery(
 *       "SELECT id, balance FROM accounts WHERE id = ?", List.of(3), context);
 *
 *   int updated = executor.executeUpdate(
 *       "UPDATE accounts SET balance = ? WHERE id = ?", List.of(150, 3));
 * </pre>
 *
 * @see DuckDBConnectionManager
 */
public class QueryExecutor implements StatementExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBConnectionManager connectionManager;

    public QueryExecutor(DuckDBConnectionManager connectionManager) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
    }

    /**
     * Executes a query and returns all of its rows.
     *
     * <p>Column names come from the result set labels. Values are returned
     * as the driver produces them.
     *
     * @param sql the SQL query with {@code ?} placeholders
     * @param parameters values bound in order
     * @param context identity the query runs under (recorded in the log)
     * @return the materialized result
     * @throws QueryExecutionException if query execution fails
     */
    @Override
    public ResultBatch executeQuery(String sql, List<Object> parameters, SessionContext context)
            throws QueryExecutionException {
        Objects.requireNonNull(sql, "sql must not be null");
        List<Object> params = parameters != null ? parameters : Collections.emptyList();

        if (logger.isDebugEnabled()) {
            logger.debug("Executing query for user={}, database={}",
                context != null ? context.user() : null,
                context != null ? context.database() : null);
        }

        try (PooledConnection pooled = connectionManager.borrowConnection();
             PreparedStatement stmt = pooled.get().prepareStatement(sql)) {

            bindParameters(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return materialize(rs);
            }

        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Executes an unparameterized query.
     *
     * @param sql the SQL query
     * @return the materialized result
     * @throws QueryExecutionException if query execution fails
     */
    public ResultBatch executeQuery(String sql) throws QueryExecutionException {
        return executeQuery(sql, Collections.emptyList(), null);
    }

    /**
     * Executes an INSERT, UPDATE, DELETE or DDL statement.
     *
     * @param sql the statement with {@code ?} placeholders
     * @param parameters values bound in order
     * @return the number of rows affected (0 for DDL)
     * @throws QueryExecutionException if execution fails
     */
    public int executeUpdate(String sql, List<Object> parameters) throws QueryExecutionException {
        Objects.requireNonNull(sql, "sql must not be null");
        List<Object> params = parameters != null ? parameters : Collections.emptyList();

        try (PooledConnection pooled = connectionManager.borrowConnection();
             PreparedStatement stmt = pooled.get().prepareStatement(sql)) {

            bindParameters(stmt, params);
            int affected = stmt.executeUpdate();
            logger.debug("Update affected {} rows", affected);
            return Math.max(affected, 0);

        } catch (SQLException e) {
            throw new QueryExecutionException(
                "Failed to execute update: " + e.getMessage(), e, sql);
        }
    }

    /**
     * @param sql the statement to execute
     * @return the number of rows affected
     * @throws QueryExecutionException if execution fails
     */
    public int executeUpdate(String sql) throws QueryExecutionException {
        return executeUpdate(sql, Collections.emptyList());
    }

    private static void bindParameters(PreparedStatement stmt, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            stmt.setObject(i + 1, parameters.get(i));
        }
    }

    private static ResultBatch materialize(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }
        return new ResultBatch(columns, rows);
    }

    public DuckDBConnectionManager getConnectionManager() {
        return connectionManager;
    }
}
