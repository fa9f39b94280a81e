package com.livequery.subscription;

import com.livequery.event.DeliveryQueue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One live reactive query.
 *
 * <p>Instances are created and destroyed only by {@link SubscriptionRegistry}.
 * Everything except the active flag is immutable. The flag has its own
 * monitor so notifications in flight can read it without the registry lock.
 */
public final class Subscription {

    private final UUID id;
    private final String statement;
    private final String sourceName;
    private final Set<PartitionId> dependentPartitions;
    private final Instant createdAt;
    private final DeliveryQueue deliveryQueue;

    private final Object activeLock = new Object();
    private boolean active = true;

    Subscription(UUID id, String statement, String sourceName,
                 Set<PartitionId> dependentPartitions, DeliveryQueue deliveryQueue) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.statement = Objects.requireNonNull(statement, "statement must not be null");
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        this.dependentPartitions = Collections.unmodifiableSet(new LinkedHashSet<>(dependentPartitions));
        this.deliveryQueue = Objects.requireNonNull(deliveryQueue, "deliveryQueue must not be null");
        this.createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    /**
     * @return the query as originally submitted
     */
    public String getStatement() {
        return statement;
    }

    public String getSourceName() {
        return sourceName;
    }

    public Set<PartitionId> getDependentPartitions() {
        return dependentPartitions;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public DeliveryQueue getDeliveryQueue() {
        return deliveryQueue;
    }

    public boolean isActive() {
        synchronized (activeLock) {
            return active;
        }
    }

    /**
     * Marks the subscription inactive.
     *
     * @return true if it was active before this call
     */
    boolean deactivate() {
        synchronized (activeLock) {
            boolean wasActive = active;
            active = false;
            return wasActive;
        }
    }

    @Override
    public String toString() {
        return String.format("Subscription[id=%s, source=%s, partitions=%s, active=%s]",
            id, sourceName, dependentPartitions, isActive());
    }
}
