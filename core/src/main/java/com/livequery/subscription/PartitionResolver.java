package com.livequery.subscription;

import java.util.Set;

/**
 * Maps a data source to the partitions its rows live in.
 *
 * <p>A production deployment asks the range cache of the storage layer; the
 * default {@link SourcePartitionResolver} treats every source as one range.
 */
public interface PartitionResolver {

    /**
     * @param sourceName normalized source name
     * @return partitions covering the source, never empty
     */
    Set<PartitionId> partitionsFor(String sourceName);
}
