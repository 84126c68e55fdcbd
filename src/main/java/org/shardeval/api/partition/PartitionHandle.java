package org.shardeval.api.partition;

import java.util.Objects;

/**
 * Identifies one contiguous partition of a distributed sequence and the worker that owns it.
 * <p>
 * Handles are small value objects: they travel freely between the coordinator and workers,
 * while the partition's rows stay with the owning worker.
 *
 * @param index  position of the partition within its sequence (0-based).
 * @param offset global row offset of the partition's first row.
 * @param length number of rows in the partition.
 * @param worker name of the worker holding the partition's data.
 */
public record PartitionHandle(int index, long offset, int length, String worker) {

    public PartitionHandle {
        if (index < 0) {
            throw new IllegalArgumentException("Partition index must be >= 0, got " + index);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Partition offset must be >= 0, got " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Partition length must be >= 0, got " + length);
        }
        Objects.requireNonNull(worker, "worker");
    }

    /**
     * Returns the global row offset one past the last row of this partition.
     *
     * @return exclusive end offset.
     */
    public long endOffset() {
        return offset + length;
    }
}
