package com.livequery.subscription;

import com.livequery.event.ChangeEvent;

/**
 * Sink for partition-scoped change notifications coming from the change feed.
 */
@FunctionalInterface
public interface PartitionChangeListener {

    /**
     * Called when a mutation was committed in the given partition.
     *
     * @param partitionId the partition that changed
     * @param event description of the mutation
     */
    void onPartitionChange(PartitionId partitionId, ChangeEvent event);
}
