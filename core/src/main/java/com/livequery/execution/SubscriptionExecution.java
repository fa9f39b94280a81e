package com.livequery.execution;

import com.livequery.event.ChangeEvent;
import com.livequery.event.DeliveryQueue;
import com.livequery.exception.QueryExecutionException;
import com.livequery.logging.QueryLogger;
import com.livequery.subscription.Subscription;
import io.grpc.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one subscription: runs its query, hands out rows, and re-runs the
 * query whenever a change event arrives on its delivery queue.
 *
 * <p>Pull model, driven by the thread of the owning client session:
 * <pre>{@code
 * execution.start();
 * while (execution.next()) {
 *     List<Object> row = execution.currentRow();
 *     // stream row to the client
 * }
 * }</pre>
 * {@code next()} blocks while the subscription waits for a change. It
 * returns false once the stream has ended: the caller's {@link Context} was
 * cancelled, the subscription was removed from the registry, or
 * {@link #close()} was called. A failing initial or refresh query closes the
 * subscription and is rethrown from {@code next()}.
 *
 * <p>Refreshes follow the keyed policy of {@link RefreshQueryBuilder}: a
 * keyed event re-reads only the changed row, an event without a key re-runs
 * the whole query. A refresh that yields no rows emits nothing and the
 * subscription keeps waiting.
 *
 * <p>Only {@link #close()} and the state getters may be called from other
 * threads.
 *
 * @see SubscriptionState
 */
public class SubscriptionExecution implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionExecution.class);

    private final Subscription subscription;
    private final StatementExecutor executor;
    private final SessionContext sessionContext;
    private final Context cancellationContext;
    private final Runnable releaseAction;
    private final Context.CancellationListener cancellationListener;

    private final AtomicReference<SubscriptionState> state =
        new AtomicReference<>(SubscriptionState.INIT);
    private final AtomicReference<SubscriptionOutcome> outcome =
        new AtomicReference<>(SubscriptionOutcome.RUNNING);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile QueryExecutionException failure;
    private volatile long refreshCount;

    /** Owned by the driving thread */
    private ExecutionCursor cursor;
    private ChangeEvent pendingEvent;
    private List<String> columns = List.of();

    /**
     * @param subscription registered subscription owning the delivery queue
     * @param executor runs the initial and refresh queries
     * @param sessionContext identity queries run under
     * @param cancellationContext caller's cancellation signal (null for none)
     * @param releaseAction called exactly once on close; releases the subscription and its queue
     */
    public SubscriptionExecution(Subscription subscription,
                                 StatementExecutor executor,
                                 SessionContext sessionContext,
                                 Context cancellationContext,
                                 Runnable releaseAction) {
        this.subscription = Objects.requireNonNull(subscription, "subscription must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.sessionContext = Objects.requireNonNull(sessionContext, "sessionContext must not be null");
        this.cancellationContext = cancellationContext != null ? cancellationContext : Context.ROOT;
        this.releaseAction = Objects.requireNonNull(releaseAction, "releaseAction must not be null");

        DeliveryQueue queue = subscription.getDeliveryQueue();
        this.cancellationListener = context -> queue.wakeup();
    }

    /**
     * Runs the initial query (INIT) and moves to SERVING, or to WAITING when it returned no rows.
     *
     * @throws QueryExecutionException if the initial query fails; the subscription is closed
     * @throws IllegalStateException if already started
     */
    public void start() throws QueryExecutionException {
        if (state.get() != SubscriptionState.INIT) {
            throw new IllegalStateException("Subscription already started: " + subscription.getId());
        }
        cancellationContext.addListener(cancellationListener, Runnable::run);

        ResultBatch batch = execute("subscribe-init", subscription.getStatement(), List.of());
        columns = batch.getColumns();
        cursor = new ExecutionCursor(batch);
        SubscriptionState initial = batch.isEmpty() ? SubscriptionState.WAITING : SubscriptionState.SERVING;
        if (!state.compareAndSet(SubscriptionState.INIT, initial)) {
            return;
        }

        logger.info("Subscription started: id={}, source={}, initialRows={}",
            subscription.getId(), subscription.getSourceName(), batch.size());
    }

    /**
     * Advances to the next row, waiting for changes when the current batch is exhausted.
     *
     * @return true if positioned on a row, false once the stream has ended
     * @throws QueryExecutionException if a query fails; the subscription is closed
     */
    public boolean next() throws QueryExecutionException {
        if (state.get() == SubscriptionState.INIT) {
            start();
        }

        while (true) {
            SubscriptionState current = state.get();
            switch (current) {
                case CLOSED:
                    return false;

                case SERVING:
                    if (cursor.advance()) {
                        return true;
                    }
                    state.compareAndSet(SubscriptionState.SERVING, SubscriptionState.WAITING);
                    break;

                case WAITING:
                    ChangeEvent event = awaitEvent();
                    if (event == null) {
                        return false;
                    }
                    pendingEvent = event;
                    state.compareAndSet(SubscriptionState.WAITING, SubscriptionState.REFRESHING);
                    break;

                case REFRESHING:
                    refresh(pendingEvent);
                    pendingEvent = null;
                    break;

                default:
                    throw new IllegalStateException("Unexpected state: " + current);
            }
        }
    }

    /**
     * @return the row {@link #next()} last positioned on
     * @throws IllegalStateException if not positioned on a row
     */
    public List<Object> currentRow() {
        if (state.get() == SubscriptionState.CLOSED) {
            throw new IllegalStateException("Subscription is closed: " + subscription.getId());
        }
        if (cursor == null) {
            throw new IllegalStateException("Subscription has not produced a row yet");
        }
        return cursor.current();
    }

    /**
     * Blocks until an event arrives, or ends the stream on cancellation or queue closure.
     */
    private ChangeEvent awaitEvent() {
        if (isCancelled()) {
            finish(SubscriptionOutcome.CANCELLED);
            return null;
        }

        ChangeEvent event;
        try {
            event = subscription.getDeliveryQueue().take(this::isCancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Subscription wait interrupted: id={}", subscription.getId());
            finish(SubscriptionOutcome.CANCELLED);
            return null;
        }

        if (event != null) {
            logger.debug("Event received: id={}, operation={}, key={}",
                subscription.getId(), event.operation(), event.key());
            return event;
        }

        if (state.get() != SubscriptionState.CLOSED) {
            finish(isCancelled() ? SubscriptionOutcome.CANCELLED : SubscriptionOutcome.UNSUBSCRIBED);
        }
        return null;
    }

    private void refresh(ChangeEvent event) {
        if (isCancelled()) {
            finish(SubscriptionOutcome.CANCELLED);
            return;
        }

        RefreshQuery query = RefreshQueryBuilder.build(subscription.getStatement(), event, columns);
        ResultBatch batch = execute("subscribe-refresh", query.sql(), query.parameters());
        refreshCount++;

        if (batch.isEmpty()) {
            logger.debug("Refresh returned no rows: id={}, keyed={}", subscription.getId(), query.keyed());
            state.compareAndSet(SubscriptionState.REFRESHING, SubscriptionState.WAITING);
            return;
        }

        cursor = new ExecutionCursor(batch);
        if (!state.compareAndSet(SubscriptionState.REFRESHING, SubscriptionState.SERVING)) {
            return;
        }
        logger.debug("Refresh installed: id={}, keyed={}, rows={}",
            subscription.getId(), query.keyed(), batch.size());
    }

    private ResultBatch execute(String purpose, String sql, List<Object> parameters) {
        String queryId = QueryLogger.newQueryId();
        QueryLogger.bindSubscription(subscription.getId());
        QueryLogger.startQuery(queryId, purpose);
        long start = System.nanoTime();
        try {
            QueryLogger.logSQL(sql, parameters.size());
            ResultBatch batch = executor.executeQuery(sql, parameters, sessionContext);
            QueryLogger.logExecution((System.nanoTime() - start) / 1_000_000, batch.size());
            return batch;
        } catch (QueryExecutionException e) {
            QueryLogger.logError(e);
            fail(e);
            throw e;
        } catch (RuntimeException e) {
            QueryLogger.logError(e);
            logger.error("Subscription query failed unexpectedly: id={}", subscription.getId(), e);
            finish(SubscriptionOutcome.FAILED);
            throw e;
        } finally {
            QueryLogger.clearContext();
            QueryLogger.unbindSubscription();
        }
    }

    private boolean isCancelled() {
        return cancellationContext.isCancelled();
    }

    private void fail(QueryExecutionException e) {
        failure = e;
        logger.warn("Subscription failed: id={}, error={}", subscription.getId(), e.getMessage());
        finish(SubscriptionOutcome.FAILED);
    }

    private void finish(SubscriptionOutcome reason) {
        outcome.compareAndSet(SubscriptionOutcome.RUNNING, reason);
        state.set(SubscriptionState.CLOSED);

        if (released.compareAndSet(false, true)) {
            cancellationContext.removeListener(cancellationListener);
            releaseAction.run();
            logger.info("Subscription closed: id={}, outcome={}, refreshes={}",
                subscription.getId(), outcome.get(), refreshCount);
        }
    }

    /**
     * Ends the stream and releases the delivery queue. Idempotent.
     */
    @Override
    public void close() {
        finish(SubscriptionOutcome.CLOSED);
    }

    public Subscription getSubscription() {
        return subscription;
    }

    public SubscriptionState getState() {
        return state.get();
    }

    public SubscriptionOutcome getOutcome() {
        return outcome.get();
    }

    public Optional<QueryExecutionException> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @return column names of the subscribed query, empty before {@link #start()}
     */
    public List<String> getColumns() {
        return columns;
    }

    public long getRefreshCount() {
        return refreshCount;
    }
}
