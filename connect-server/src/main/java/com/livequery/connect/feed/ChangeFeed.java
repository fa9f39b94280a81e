package com.livequery.connect.feed;

import com.livequery.event.ChangeEvent;
import com.livequery.subscription.PartitionChangeListener;
import com.livequery.subscription.PartitionId;

/**
 * Source of partition-level change notifications, such as a replication
 * stream. Listeners receive every change reported for any partition.
 */
public interface ChangeFeed extends AutoCloseable {

    /**
     * Reports that a partition's data changed.
     *
     * @param partitionId the changed partition
     * @param event the mutation
     */
    void emit(PartitionId partitionId, ChangeEvent event);

    /**
     * @return a token for {@link #removeListener(String)}
     */
    String addListener(PartitionChangeListener listener);

    /**
     * @return true if the listener was registered
     */
    boolean removeListener(String token);

    boolean isOpen();

    @Override
    void close();
}
