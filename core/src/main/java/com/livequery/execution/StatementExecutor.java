package com.livequery.execution;

import com.livequery.exception.QueryExecutionException;

import java.util.List;

/**
 * Runs query text against the database on behalf of a subscription.
 *
 * <p>Implementations must bind {@code parameters} to the positional
 * {@code ?} placeholders of the statement rather than splicing them into the
 * text. The call may block; it must be safe to invoke from several
 * subscription threads at once.
 */
@FunctionalInterface
public interface StatementExecutor {

    /**
     * @param sql statement text with {@code ?} placeholders
     * @param parameters values for the placeholders, in order
     * @param context identity the statement runs under
     * @return the materialized result
     * @throws QueryExecutionException if the statement fails
     */
    ResultBatch executeQuery(String sql, List<Object> parameters, SessionContext context)
        throws QueryExecutionException;
}
