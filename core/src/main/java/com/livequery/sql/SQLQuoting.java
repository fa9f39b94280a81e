package com.livequery.sql;

/**
 * Utilities for safely quoting SQL identifiers and literals.
 *
 * <p>Values that come from change events are never quoted into SQL text; they
 * are bound as statement parameters. Quoting is only used for identifiers
 * (key column names) and for rendering statements back to text.
 *
 * <p>Example usage:
 * <pre>
 *   String column = SQLQuoting.quoteIdentifier("id");
 *   // Result: "id"
 *
 *   String literal = SQLQuoting.quoteLiteral("O'Reilly");
 *   // Result: 'O''Reilly'
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes a string literal value, or returns NULL for null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Reverses {@link #quoteLiteral(String)} for a single-quoted literal.
     *
     * @param quoted text including the surrounding quotes
     * @return the literal value
     * @throws IllegalArgumentException if the text is not a single-quoted literal
     */
    public static String unquoteLiteral(String quoted) {
        if (quoted == null || quoted.length() < 2
                || quoted.charAt(0) != '\'' || quoted.charAt(quoted.length() - 1) != '\'') {
            throw new IllegalArgumentException("Not a quoted literal: " + quoted);
        }
        return quoted.substring(1, quoted.length() - 1).replace("''", "'");
    }

    /**
     * Removes trailing semicolons and whitespace so a statement can be nested as a sub-query.
     */
    public static String stripTrailingTerminator(String sql) {
        String trimmed = sql.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
