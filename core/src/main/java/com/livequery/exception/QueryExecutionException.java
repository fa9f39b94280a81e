package com.livequery.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when executing a subscribed query, a refresh query or a
 * mutation fails.
 *
 * <p>Wraps the underlying {@link java.sql.SQLException} with the SQL that
 * failed and translates common DuckDB error texts into actionable messages.
 * A subscription that hits this exception is closed before it is rethrown.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       while (handle.next()) { ... }
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 */
public class QueryExecutionException extends RuntimeException {

    private static final Pattern MISSING_COLUMN = Pattern.compile("column \"([^\"]+)\" not found");
    private static final Pattern MISSING_TABLE = Pattern.compile("Table with name ([^ ]+) does not exist");
    private static final Pattern SYNTAX_NEAR = Pattern.compile("syntax error at or near \"([^\"]+)\"");

    private final String failedSQL;

    /**
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message for common DuckDB failures.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();
        if (message == null) {
            return "Query execution failed. Check SQL syntax and data types.";
        }

        if (message.contains("Binder Error") && message.contains("not found")) {
            Matcher matcher = MISSING_COLUMN.matcher(message);
            if (matcher.find()) {
                return "Column '" + matcher.group(1) + "' not found. " +
                       "Check column name spelling against the subscribed query.";
            }
            return "Column not found: " + message;
        }

        if (message.contains("Catalog Error")) {
            Matcher matcher = MISSING_TABLE.matcher(message);
            if (matcher.find()) {
                return "Table '" + matcher.group(1) + "' does not exist.";
            }
            return "Table error: " + message;
        }

        if (message.contains("Conversion Error") || message.contains("Mismatch Type Error")) {
            return "Data type mismatch in query. " +
                   "Check that key values match the types of the key columns.";
        }

        if (message.contains("Syntax Error") || message.contains("Parser Error")) {
            Matcher matcher = SYNTAX_NEAR.matcher(message);
            if (matcher.find()) {
                return "SQL syntax error near '" + matcher.group(1) + "'.";
            }
            return "SQL syntax error. Check statement for typos and proper syntax.";
        }

        if (message.contains("Constraint Error")) {
            return "Constraint violated: " + message;
        }

        if (message.contains("Out of Memory Error")) {
            return "Query requires more memory than available. Try adding filters.";
        }

        return "Query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
