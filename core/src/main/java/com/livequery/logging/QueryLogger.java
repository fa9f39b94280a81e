package com.livequery.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for query executions.
 *
 * <p>Puts a query id into the SLF4J MDC so every line logged while the query
 * runs can be correlated, and records timing and row counts. The context is
 * thread-local; callers must call {@link #clearContext()} in a finally block.
 *
 * <pre>
 *   String queryId = QueryLogger.newQueryId();
 *   QueryLogger.startQuery(queryId, "subscribe-refresh");
 *   try {
 *       ...
 *       QueryLogger.logExecution(elapsedMs, rows);
 *   } finally {
 *       QueryLogger.clearContext();
 *   }
 * </pre>
 */
public final class QueryLogger {
    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    public static final String MDC_QUERY_ID = "queryId";
    public static final String MDC_SUBSCRIPTION_ID = "subscriptionId";

    private QueryLogger() {}

    public static String newQueryId() {
        return "q_" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * @param queryId correlation id
     * @param purpose short label such as "subscribe-init" or "subscribe-refresh"
     */
    public static void startQuery(String queryId, String purpose) {
        MDC.put(MDC_QUERY_ID, queryId);
        logger.debug("Query started: id={}, purpose={}", queryId, purpose);
    }

    public static void logSQL(String sql, int parameterCount) {
        if (logger.isDebugEnabled()) {
            String truncated = sql.length() > 200 ? sql.substring(0, 200) + "..." : sql;
            logger.debug("SQL ({} parameters): {}", parameterCount, truncated);
        }
    }

    public static void logExecution(long execTimeMs, long rowCount) {
        logger.debug("Query executed in {}ms, rows={}", execTimeMs, rowCount);
    }

    public static void logError(Throwable error) {
        logger.warn("Query failed: {}", error.getMessage());
    }

    /**
     * Binds the subscription id to the current thread's logging context.
     */
    public static void bindSubscription(UUID subscriptionId) {
        MDC.put(MDC_SUBSCRIPTION_ID, String.valueOf(subscriptionId));
    }

    public static void unbindSubscription() {
        MDC.remove(MDC_SUBSCRIPTION_ID);
    }

    /**
     * Removes the query id from the logging context.
     */
    public static void clearContext() {
        MDC.remove(MDC_QUERY_ID);
    }
}
