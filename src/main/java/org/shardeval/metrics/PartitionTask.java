package org.shardeval.metrics;

import org.shardeval.api.partition.PartitionHandle;

/**
 * A unit of work computed on the worker that owns one partition.
 *
 * @param <R> type of the partial result shipped back to the coordinator.
 */
@FunctionalInterface
public interface PartitionTask<R> {

    /**
     * Computes a partial result for one partition.
     *
     * @param partition the partition to process; its slices are local to the calling thread.
     * @return the partial result.
     * @throws Exception if the local computation fails.
     */
    R run(PartitionHandle partition) throws Exception;
}
