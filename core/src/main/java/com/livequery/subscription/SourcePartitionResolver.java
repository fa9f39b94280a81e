package com.livequery.subscription;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Assigns each source a single partition, numbered in order of first use.
 */
public class SourcePartitionResolver implements PartitionResolver {

    private final ConcurrentHashMap<String, PartitionId> partitions = new ConcurrentHashMap<>();
    private final AtomicLong nextRangeId = new AtomicLong(1);

    @Override
    public Set<PartitionId> partitionsFor(String sourceName) {
        String source = sourceName.trim().toLowerCase(Locale.ROOT);
        return Set.of(partitions.computeIfAbsent(source,
            s -> PartitionId.of(nextRangeId.getAndIncrement())));
    }
}
