package com.livequery.execution;

import com.livequery.event.ChangeEvent;
import com.livequery.sql.SQLQuoting;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the query a subscription re-runs after a change event.
 *
 * <p>With a key the subscribed statement is nested as a named sub-query and
 * filtered to the changed row:
 * <pre>
 *   WITH base AS (SELECT * FROM accounts WHERE balance &gt; 100
 *   ) SELECT * FROM base WHERE base."id" = ?
 * </pre>
 * The statement is closed on a new line so a trailing line comment cannot
 * swallow the filter. Key values are always bound as parameters; only the
 * column names, which are quoted identifiers, become part of the text. A
 * null key value is matched with {@code IS NULL}.
 *
 * <p>Without a key, or when the statement's result does not expose every
 * key column (aggregates, projections leaving out the key), the original
 * statement is returned unchanged.
 */
public final class RefreshQueryBuilder {

    /** Name of the sub-query wrapping the subscribed statement */
    public static final String BASE_ALIAS = "base";

    private RefreshQueryBuilder() {}

    public static RefreshQuery build(String statement, ChangeEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        return build(statement, event.key());
    }

    /**
     * @param statement the subscribed statement
     * @param event the change event
     * @param resultColumns column names the statement returns
     * @return a keyed refresh if every key column is among {@code resultColumns}, else a full refresh
     */
    public static RefreshQuery build(String statement, ChangeEvent event, List<String> resultColumns) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(resultColumns, "resultColumns must not be null");
        if (!exposesKey(resultColumns, event.key())) {
            return build(statement, Map.of());
        }
        return build(statement, event.key());
    }

    static boolean exposesKey(List<String> resultColumns, Map<String, Object> key) {
        Set<String> available = new HashSet<>();
        for (String column : resultColumns) {
            available.add(column.toLowerCase(Locale.ROOT));
        }
        for (String keyColumn : key.keySet()) {
            if (!available.contains(keyColumn.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param statement the subscribed statement
     * @param key changed row's key columns and values, possibly empty
     * @return the refresh query
     */
    public static RefreshQuery build(String statement, Map<String, Object> key) {
        Objects.requireNonNull(statement, "statement must not be null");
        if (key == null || key.isEmpty()) {
            return new RefreshQuery(statement, List.of(), false);
        }

        StringBuilder sql = new StringBuilder();
        sql.append("WITH ").append(BASE_ALIAS).append(" AS (")
           .append(SQLQuoting.stripTrailingTerminator(statement))
           .append("\n) SELECT * FROM ").append(BASE_ALIAS).append(" WHERE ");

        List<Object> parameters = new ArrayList<>(key.size());
        boolean first = true;
        for (Map.Entry<String, Object> entry : key.entrySet()) {
            if (!first) {
                sql.append(" AND ");
            }
            first = false;

            sql.append(BASE_ALIAS).append('.').append(SQLQuoting.quoteIdentifier(entry.getKey()));
            if (entry.getValue() == null) {
                sql.append(" IS NULL");
            } else {
                sql.append(" = ?");
                parameters.add(entry.getValue());
            }
        }

        return new RefreshQuery(sql.toString(), parameters, true);
    }
}
