package com.livequery.subscription;

/**
 * Identifier of a contiguous key range of a data source, the unit at which
 * the change feed reports mutations.
 *
 * @param rangeId numeric range identifier
 */
public record PartitionId(long rangeId) {

    public static PartitionId of(long rangeId) {
        return new PartitionId(rangeId);
    }

    @Override
    public String toString() {
        return "r" + rangeId;
    }
}
