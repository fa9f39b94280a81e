package com.livequery.connect.service;

import com.livequery.exception.QueryExecutionException;
import com.livequery.execution.SubscriptionExecution;
import com.livequery.execution.SubscriptionOutcome;
import com.livequery.execution.SubscriptionState;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Client-facing handle of one live subscription.
 *
 * <p>Iterate with {@link #next()} and {@link #currentRow()} on the thread
 * that owns the client session; {@link #close()} may be called from any thread.
 */
public final class SubscriptionHandle implements AutoCloseable {

    private final SubscriptionExecution execution;

    SubscriptionHandle(SubscriptionExecution execution) {
        this.execution = Objects.requireNonNull(execution, "execution must not be null");
    }

    public UUID getId() {
        return execution.getSubscription().getId();
    }

    public String getStatement() {
        return execution.getSubscription().getStatement();
    }

    public String getSourceName() {
        return execution.getSubscription().getSourceName();
    }

    /**
     * Blocks until a row is available or the stream ends.
     *
     * @return true if positioned on a row
     * @throws QueryExecutionException if the subscription failed
     */
    public boolean next() throws QueryExecutionException {
        return execution.next();
    }

    public List<Object> currentRow() {
        return execution.currentRow();
    }

    /**
     * @return result column names captured by the initial execution
     */
    public List<String> columns() {
        return execution.getColumns();
    }

    public SubscriptionState getState() {
        return execution.getState();
    }

    public SubscriptionOutcome getOutcome() {
        return execution.getOutcome();
    }

    public long getRefreshCount() {
        return execution.getRefreshCount();
    }

    public boolean isClosed() {
        return execution.getState() == SubscriptionState.CLOSED;
    }

    SubscriptionExecution getExecution() {
        return execution;
    }

    @Override
    public void close() {
        execution.close();
    }

    @Override
    public String toString() {
        return String.format("SubscriptionHandle[id=%s, state=%s, outcome=%s]",
            getId(), getState(), getOutcome());
    }
}
