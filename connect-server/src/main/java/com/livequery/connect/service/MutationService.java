package com.livequery.connect.service;

import com.livequery.event.ChangeEvent;
import com.livequery.event.ChangeEventFanout;
import com.livequery.event.Operation;
import com.livequery.exception.QueryExecutionException;
import com.livequery.runtime.QueryExecutor;
import com.livequery.sql.MutationAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Write path: runs a DML statement and, once it has succeeded, publishes a
 * {@link ChangeEvent} so subscriptions on the table refresh.
 *
 * <p>The event is published only when the statement changed at least one
 * row. Key columns registered with {@link #registerKeyColumns} let
 * {@link #execute(String)} derive the changed row's key from the statement
 * text; without them subscribers refresh in full.
 */
public class MutationService {
    private static final Logger logger = LoggerFactory.getLogger(MutationService.class);

    private final QueryExecutor executor;
    private final ChangeEventFanout fanout;
    private final Map<String, List<String>> keyColumns = new ConcurrentHashMap<>();

    public MutationService(QueryExecutor executor, ChangeEventFanout fanout) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.fanout = Objects.requireNonNull(fanout, "fanout must not be null");
    }

    /**
     * Declares the key columns of a table, in key order.
     */
    public void registerKeyColumns(String table, List<String> columns) {
        Objects.requireNonNull(table, "table must not be null");
        keyColumns.put(table.trim().toLowerCase(Locale.ROOT), List.copyOf(columns));
    }

    public List<String> getKeyColumns(String table) {
        return keyColumns.getOrDefault(table.trim().toLowerCase(Locale.ROOT), Collections.emptyList());
    }

    /**
     * Runs a mutation whose target and key are known to the caller.
     *
     * @param update DML statement with {@code ?} placeholders
     * @param parameters values bound in order
     * @param sourceName table the statement changes
     * @param operation kind of change
     * @param key key of the changed row (empty if unknown)
     * @return rows affected
     * @throws QueryExecutionException if the statement fails; nothing is published
     */
    public int execute(String update, List<Object> parameters, String sourceName,
                       Operation operation, Map<String, Object> key) {
        ChangeEvent event = new ChangeEvent(sourceName, operation, key);
        int affected = executor.executeUpdate(update, parameters);
        publishIfChanged(event, affected);
        return affected;
    }

    /**
     * @see #execute(String, List, String, Operation, Map)
     */
    public int execute(String update, String sourceName, Operation operation, Map<String, Object> key) {
        return execute(update, Collections.emptyList(), sourceName, operation, key);
    }

    /**
     * Runs a literal DML statement, deriving the event from its text.
     *
     * <p>Statements that are not a recognisable INSERT, UPDATE or DELETE run
     * without publishing anything.
     *
     * @param dml the statement
     * @return rows affected
     * @throws QueryExecutionException if the statement fails
     */
    public int execute(String dml) {
        Optional<ChangeEvent> event = analyze(dml);
        int affected = executor.executeUpdate(dml);
        if (event.isPresent()) {
            publishIfChanged(event.get(), affected);
        } else {
            logger.debug("Statement is not a recognised mutation, nothing published");
        }
        return affected;
    }

    Optional<ChangeEvent> analyze(String dml) {
        Optional<ChangeEvent> unkeyed = MutationAnalyzer.analyze(dml, Collections.emptyList());
        if (unkeyed.isEmpty()) {
            return unkeyed;
        }
        List<String> columns = getKeyColumns(unkeyed.get().sourceName());
        return columns.isEmpty() ? unkeyed : MutationAnalyzer.analyze(dml, columns);
    }

    private void publishIfChanged(ChangeEvent event, int affected) {
        if (affected <= 0) {
            logger.debug("Mutation on {} changed no rows, nothing published", event.sourceName());
            return;
        }
        int delivered = fanout.publish(event);
        logger.debug("Mutation published: source={}, operation={}, key={}, rows={}, delivered={}",
            event.sourceName(), event.operation(), event.key(), affected, delivered);
    }
}
