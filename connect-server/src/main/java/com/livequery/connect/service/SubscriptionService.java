package com.livequery.connect.service;

import com.livequery.exception.QueryExecutionException;
import com.livequery.execution.SessionContext;
import com.livequery.execution.StatementExecutor;
import com.livequery.execution.SubscriptionExecution;
import com.livequery.sql.SourceNameExtractor;
import com.livequery.subscription.PartitionId;
import com.livequery.subscription.PartitionResolver;
import com.livequery.subscription.Subscription;
import com.livequery.subscription.SubscriptionRegistry;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the statement-execution layer into the subscription engine.
 *
 * <p>{@link #subscribe} registers the query, runs it once and returns a handle
 * positioned before the first row. The caller then pulls rows with
 * {@link #next} and {@link #currentRow}; once the initial rows are consumed
 * {@code next} blocks until a change to the source table produces new rows.
 *
 * <p>Example usage:
 * <pre>
 *   SubscriptionHandle handle = service.subscribe(
 *       "SELECT * FROM accounts WHERE balance > 100", "accounts", "alice", "main");
 *   while (service.next(handle)) {
 *       send(service.currentRow(handle));
 *   }
 * </pre>
 */
public class SubscriptionService {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

    private final SubscriptionRegistry registry;
    private final PartitionResolver partitionResolver;
    private final StatementExecutor executor;
    private final int maxSubscriptions;

    private final Map<UUID, SubscriptionHandle> handles = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * @param registry subscription registry
     * @param partitionResolver maps a source table to the partitions it spans
     * @param executor runs initial and refresh queries
     * @param maxSubscriptions live subscription limit (0 = unlimited)
     */
    public SubscriptionService(SubscriptionRegistry registry,
                               PartitionResolver partitionResolver,
                               StatementExecutor executor,
                               int maxSubscriptions) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.partitionResolver = Objects.requireNonNull(partitionResolver, "partitionResolver must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (maxSubscriptions < 0) {
            throw new IllegalArgumentException("maxSubscriptions must be non-negative");
        }
        this.maxSubscriptions = maxSubscriptions;
    }

    /**
     * Subscribes under the caller's current gRPC context.
     *
     * @see #subscribe(String, String, String, String, Context)
     */
    public SubscriptionHandle subscribe(String statementText, String sourceIdentity,
                                        String sessionUser, String database) {
        return subscribe(statementText, sourceIdentity, sessionUser, database, Context.current());
    }

    /**
     * Registers a subscription and runs its initial query.
     *
     * @param statementText the query to keep evaluating
     * @param sourceIdentity table the query depends on; derived from the query text when null
     * @param sessionUser user the query runs as
     * @param database current database of the session (may be null)
     * @param cancellationContext cancelling this context ends the stream
     * @return handle positioned before the first row
     * @throws StatusRuntimeException UNAVAILABLE when shutting down, INVALID_ARGUMENT when
     *         the source cannot be determined, RESOURCE_EXHAUSTED when the limit is reached
     * @throws QueryExecutionException if the initial query fails
     */
    public SubscriptionHandle subscribe(String statementText, String sourceIdentity,
                                        String sessionUser, String database,
                                        Context cancellationContext) {
        if (shuttingDown.get()) {
            throw new StatusRuntimeException(
                Status.UNAVAILABLE.withDescription("Server is shutting down"));
        }
        if (statementText == null || statementText.isBlank()) {
            throw new StatusRuntimeException(
                Status.INVALID_ARGUMENT.withDescription("Subscription query must not be empty"));
        }

        String sourceName = resolveSource(statementText, sourceIdentity);
        Set<PartitionId> partitions = partitionResolver.partitionsFor(sourceName);

        UUID id;
        synchronized (admissionLock) {
            if (maxSubscriptions > 0 && registry.size() >= maxSubscriptions) {
                throw new StatusRuntimeException(
                    Status.RESOURCE_EXHAUSTED.withDescription(String.format(
                        "Subscription limit reached (%d active). Close a subscription and try again.",
                        registry.size())));
            }
            id = registry.subscribe(statementText, sourceName, partitions);
        }

        Subscription subscription = registry.get(id)
            .orElseThrow(() -> new IllegalStateException("Subscription vanished during creation: " + id));

        SubscriptionExecution execution = new SubscriptionExecution(
            subscription,
            executor,
            new SessionContext(sessionUser, database),
            cancellationContext,
            () -> release(id));
        SubscriptionHandle handle = new SubscriptionHandle(execution);
        handles.put(id, handle);

        execution.start();
        logger.info("Subscription opened: id={}, user={}, source={}, partitions={}",
            id, sessionUser, sourceName, partitions);
        return handle;
    }

    private String resolveSource(String statementText, String sourceIdentity) {
        if (sourceIdentity != null && !sourceIdentity.isBlank()) {
            return sourceIdentity.trim();
        }
        Optional<String> extracted = SourceNameExtractor.extractSourceName(statementText);
        if (extracted.isEmpty()) {
            throw new StatusRuntimeException(
                Status.INVALID_ARGUMENT.withDescription(
                    "Cannot determine the source table of the subscription query; "
                        + "it must read from exactly one table"));
        }
        return extracted.get();
    }

    private void release(UUID id) {
        handles.remove(id);
        registry.unsubscribe(id);
    }

    /**
     * @see SubscriptionHandle#next()
     */
    public boolean next(SubscriptionHandle handle) throws QueryExecutionException {
        return handle.next();
    }

    /**
     * @see SubscriptionHandle#currentRow()
     */
    public List<Object> currentRow(SubscriptionHandle handle) {
        return handle.currentRow();
    }

    /**
     * Closes the subscription and releases its resources. Idempotent.
     */
    public void close(SubscriptionHandle handle) {
        if (handle != null) {
            handle.close();
        }
    }

    /**
     * Removes a subscription independently of the session that owns it.
     * Its stream ends once the owner has consumed the rows already buffered.
     *
     * @param id subscription id
     * @return true if a live subscription was removed, false if the id is unknown
     */
    public boolean unsubscribeById(UUID id) {
        boolean removed = registry.unsubscribe(id);
        if (removed) {
            logger.info("Subscription removed administratively: id={}", id);
        }
        return removed;
    }

    public Optional<SubscriptionInfo> getSubscriptionInfo(UUID id) {
        return registry.get(id).map(SubscriptionInfo::of);
    }

    public List<SubscriptionInfo> listSubscriptions() {
        List<SubscriptionInfo> infos = new ArrayList<>();
        for (Subscription subscription : registry.getSubscriptions()) {
            infos.add(SubscriptionInfo.of(subscription));
        }
        return infos;
    }

    public int getActiveCount() {
        return registry.size();
    }

    public int getMaxSubscriptions() {
        return maxSubscriptions;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Rejects new subscriptions and closes every live one.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down SubscriptionService: {} live subscriptions", handles.size());

        for (SubscriptionHandle handle : new ArrayList<>(handles.values())) {
            handle.close();
        }
        int leftover = registry.unsubscribeAll();
        if (leftover > 0) {
            logger.warn("Removed {} subscriptions without an open handle", leftover);
        }
    }
}
