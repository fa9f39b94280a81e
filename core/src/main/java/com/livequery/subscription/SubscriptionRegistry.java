package com.livequery.subscription;

import com.livequery.event.ChangeEvent;
import com.livequery.event.ChangeEventFanout;
import com.livequery.event.DeliveryQueue;
import com.livequery.sql.SourceNameExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the live subscriptions and the reverse index from partition to the
 * subscriptions that depend on it.
 *
 * <p>Both maps are guarded by one read/write lock and always change in the
 * same critical section: a subscription is in the primary map and in the
 * index entry of every partition it declared, or in neither. Empty index
 * entries are removed.
 *
 * <p>Delivery queues are obtained from and released to the
 * {@link ChangeEventFanout}, outside the registry lock.
 */
public class SubscriptionRegistry implements PartitionChangeListener {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ChangeEventFanout fanout;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Guarded by {@link #lock} */
    private final Map<UUID, Subscription> subscriptions = new HashMap<>();

    /** Guarded by {@link #lock} */
    private final Map<PartitionId, Set<UUID>> partitionIndex = new HashMap<>();

    public SubscriptionRegistry(ChangeEventFanout fanout) {
        this.fanout = Objects.requireNonNull(fanout, "fanout must not be null");
    }

    /**
     * Registers a subscription whose source is read from the statement text.
     *
     * @throws IllegalArgumentException if no single source can be identified
     */
    public UUID subscribe(String statement, Set<PartitionId> partitions) {
        String source = SourceNameExtractor.extractSourceName(statement)
            .orElseThrow(() -> new IllegalArgumentException(
                "Cannot determine the source table of: " + statement));
        return subscribe(statement, source, partitions);
    }

    /**
     * Registers a subscription.
     *
     * @param statement the query, opaque to the registry
     * @param sourceName source whose change events wake the subscription
     * @param partitions partitions the query reads
     * @return the new subscription id
     */
    public UUID subscribe(String statement, String sourceName, Set<PartitionId> partitions) {
        Objects.requireNonNull(statement, "statement must not be null");
        Objects.requireNonNull(partitions, "partitions must not be null");

        DeliveryQueue queue = fanout.subscribe(sourceName);
        Subscription subscription;

        lock.writeLock().lock();
        try {
            UUID id = UUID.randomUUID();
            while (subscriptions.containsKey(id)) {
                id = UUID.randomUUID();
            }
            subscription = new Subscription(id, statement, queue.getSourceName(), partitions, queue);

            subscriptions.put(id, subscription);
            for (PartitionId partition : subscription.getDependentPartitions()) {
                partitionIndex.computeIfAbsent(partition, p -> new HashSet<>()).add(id);
            }
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Subscription created: id={}, source={}, partitions={}",
            subscription.getId(), subscription.getSourceName(), subscription.getDependentPartitions());
        return subscription.getId();
    }

    /**
     * Removes a subscription and releases its delivery queue.
     * Unknown or already removed ids are ignored.
     *
     * @return true if this call removed the subscription
     */
    public boolean unsubscribe(UUID id) {
        if (id == null) {
            return false;
        }

        Subscription subscription;
        lock.writeLock().lock();
        try {
            subscription = subscriptions.remove(id);
            if (subscription == null) {
                return false;
            }
            subscription.deactivate();
            for (PartitionId partition : subscription.getDependentPartitions()) {
                Set<UUID> ids = partitionIndex.get(partition);
                if (ids != null) {
                    ids.remove(id);
                    if (ids.isEmpty()) {
                        partitionIndex.remove(partition);
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        fanout.unsubscribe(subscription.getSourceName(), subscription.getDeliveryQueue());
        logger.info("Subscription removed: id={}", id);
        return true;
    }

    @Override
    public void onPartitionChange(PartitionId partitionId, ChangeEvent event) {
        notifyPartition(partitionId, event);
    }

    /**
     * Forwards a partition-level change to every active subscription that depends on the partition.
     *
     * @return number of subscriptions the event was forwarded to
     */
    public int notifyPartition(PartitionId partitionId, ChangeEvent event) {
        List<Subscription> targets;
        lock.readLock().lock();
        try {
            Set<UUID> ids = partitionIndex.get(partitionId);
            if (ids == null || ids.isEmpty()) {
                return 0;
            }
            targets = new ArrayList<>(ids.size());
            for (UUID id : ids) {
                Subscription subscription = subscriptions.get(id);
                if (subscription != null) {
                    targets.add(subscription);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        int notified = 0;
        for (Subscription subscription : targets) {
            if (!subscription.isActive()) {
                continue;
            }
            fanout.deliver(subscription.getDeliveryQueue(), event);
            notified++;
        }
        logger.debug("Partition change: partition={}, operation={}, notified={}",
            partitionId, event.operation(), notified);
        return notified;
    }

    public Optional<Subscription> get(UUID id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(subscriptions.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return ids indexed under the partition (a copy)
     */
    public Set<UUID> subscriptionIdsFor(PartitionId partitionId) {
        lock.readLock().lock();
        try {
            Set<UUID> ids = partitionIndex.get(partitionId);
            return ids == null ? Collections.emptySet() : Collections.unmodifiableSet(new HashSet<>(ids));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return partitions with at least one dependent subscription
     */
    public Set<PartitionId> getIndexedPartitions() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(partitionIndex.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Subscription> getSubscriptions() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(subscriptions.values()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return subscriptions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every subscription. Used at shutdown.
     *
     * @return number of subscriptions removed
     */
    public int unsubscribeAll() {
        int removed = 0;
        for (Subscription subscription : getSubscriptions()) {
            if (unsubscribe(subscription.getId())) {
                removed++;
            }
        }
        return removed;
    }
}
