package com.livequery.connect.service;

import com.livequery.subscription.PartitionId;
import com.livequery.subscription.Subscription;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable snapshot of a registered subscription, for diagnostics and administration.
 */
public record SubscriptionInfo(
    UUID id,
    String statement,
    String sourceName,
    Set<PartitionId> partitions,
    Instant createdAt,
    boolean active
) {
    public SubscriptionInfo {
        partitions = Set.copyOf(partitions);
    }

    public static SubscriptionInfo of(Subscription subscription) {
        return new SubscriptionInfo(
            subscription.getId(),
            subscription.getStatement(),
            subscription.getSourceName(),
            subscription.getDependentPartitions(),
            subscription.getCreatedAt(),
            subscription.isActive());
    }
}
